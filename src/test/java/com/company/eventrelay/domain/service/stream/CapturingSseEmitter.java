package com.company.eventrelay.domain.service.stream;

import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Emitter that records the raw text of every frame instead of writing to a response.
 */
class CapturingSseEmitter extends SseEmitter {

    private static final Pattern EVENT_NAME = Pattern.compile("event:(\\S+)");

    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean failing;
    private volatile boolean completed;
    private volatile int stallAfterFrames = -1;
    private final CountDownLatch resumed = new CountDownLatch(1);

    @Override
    public void send(SseEventBuilder builder) throws IOException {
        if (failing) {
            throw new IOException("Broken pipe");
        }
        if (stallAfterFrames >= 0 && frames.size() >= stallAfterFrames) {
            try {
                resumed.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Write interrupted", e);
            }
        }
        StringBuilder frame = new StringBuilder();
        for (ResponseBodyEmitter.DataWithMediaType part : builder.build()) {
            frame.append(part.getData());
        }
        frames.add(frame.toString());
    }

    @Override
    public synchronized void complete() {
        completed = true;
        super.complete();
    }

    void failWrites() {
        this.failing = true;
    }

    /**
     * Makes every write after the given number of frames block until {@link #resume()},
     * like a client that stopped reading.
     */
    void stallAfter(int frameCount) {
        this.stallAfterFrames = frameCount;
    }

    void resume() {
        resumed.countDown();
    }

    boolean isCompleted() {
        return completed;
    }

    List<String> frames() {
        return frames;
    }

    List<String> eventNames() {
        return frames.stream()
                .map(frame -> {
                    Matcher matcher = EVENT_NAME.matcher(frame);
                    return matcher.find() ? matcher.group(1) : "";
                })
                .collect(Collectors.toList());
    }

    List<String> framesNamed(String eventName) {
        return frames.stream()
                .filter(frame -> frame.contains("event:" + eventName + "\n"))
                .collect(Collectors.toList());
    }
}
