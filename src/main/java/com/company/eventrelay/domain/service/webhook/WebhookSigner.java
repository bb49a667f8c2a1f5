package com.company.eventrelay.domain.service.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes and verifies keyed signatures over outbound webhook bodies.
 * Signatures are hex HMACs prefixed with an algorithm tag, e.g. {@code sha256=ab12...},
 * so receivers can tell which scheme produced them.
 */
@Service
public class WebhookSigner {

    private static final Logger logger = LoggerFactory.getLogger(WebhookSigner.class);

    private final String algorithm;
    private final String prefix;

    public WebhookSigner(
            @Value("${webhook.signature.algorithm:HmacSHA256}") String algorithm,
            @Value("${webhook.signature.prefix:sha256=}") String prefix) {
        try {
            Mac.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unsupported signature algorithm: " + algorithm, e);
        }
        this.algorithm = algorithm;
        this.prefix = prefix;
    }

    /**
     * Signs the exact bytes that will be sent.
     *
     * @param secret The subscription's shared secret
     * @param payload The serialized request body
     * @return The tagged signature
     */
    public String sign(String secret, byte[] payload) {
        return prefix + HexFormat.of().formatHex(hmac(secret, payload));
    }

    /**
     * Recomputes the signature of a payload and compares it with the supplied one
     * in constant time.
     *
     * @param secret The shared secret
     * @param payload The received body
     * @param signature The received signature header value
     * @return true if the signature matches
     */
    public boolean verify(String secret, byte[] payload, String signature) {
        if (secret == null || payload == null || signature == null) {
            return false;
        }
        return constantTimeEquals(sign(secret, payload), signature);
    }

    private byte[] hmac(String secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
            return mac.doFinal(payload);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            logger.error("Error computing webhook signature with {}: {}", algorithm, e.getMessage());
            throw new IllegalStateException("Unable to sign webhook payload", e);
        }
    }

    /**
     * Compares two strings without short-circuiting on the first differing byte.
     */
    private boolean constantTimeEquals(String a, String b) {
        byte[] aBytes = a.getBytes(StandardCharsets.UTF_8);
        byte[] bBytes = b.getBytes(StandardCharsets.UTF_8);

        if (aBytes.length != bBytes.length) {
            return false;
        }

        int result = 0;
        for (int i = 0; i < aBytes.length; i++) {
            result |= aBytes[i] ^ bBytes[i];
        }
        return result == 0;
    }
}
