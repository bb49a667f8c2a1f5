package com.company.eventrelay.infrastructure.http;

import org.apache.http.HeaderElement;
import org.apache.http.HeaderElementIterator;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.conn.ConnectionKeepAliveStrategy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.message.BasicHeaderElementIterator;
import org.apache.http.protocol.HTTP;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Configuration for the HTTP client used for outbound webhook calls.
 * Provides a RestTemplate over a pooled Apache HttpClient with bounded
 * connect, read and pool-wait timeouts, so one stuck subscriber cannot hold
 * a delivery thread indefinitely.
 */
@Configuration
public class HttpClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientConfig.class);

    @Value("${webhook.http.connect-timeout-ms:5000}")
    private int connectTimeout;

    @Value("${webhook.http.read-timeout-ms:30000}")
    private int readTimeout;

    @Value("${webhook.http.connection-request-timeout-ms:2000}")
    private int connectionRequestTimeout;

    @Value("${webhook.http.max-total-connections:100}")
    private int maxTotalConnections;

    @Value("${webhook.http.max-connections-per-route:20}")
    private int maxConnectionsPerRoute;

    @Value("${webhook.http.keep-alive-ms:30000}")
    private long defaultKeepAliveTime;

    @Value("${webhook.http.validate-after-inactivity-ms:10000}")
    private int validateAfterInactivity;

    private PoolingHttpClientConnectionManager connectionManager;

    /**
     * RestTemplate used for webhook delivery. Non-2xx responses are returned to
     * the caller rather than thrown, since the delivery engine classifies them itself.
     */
    @Bean
    public RestTemplate restTemplate() {
        RestTemplate restTemplate = new RestTemplate(clientHttpRequestFactory());
        restTemplate.setErrorHandler(new PassThroughResponseErrorHandler());
        return restTemplate;
    }

    @Bean
    public ClientHttpRequestFactory clientHttpRequestFactory() {
        return new HttpComponentsClientHttpRequestFactory(httpClient());
    }

    @Bean
    public CloseableHttpClient httpClient() {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(connectionRequestTimeout)
                .setConnectTimeout(connectTimeout)
                .setSocketTimeout(readTimeout)
                .build();

        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .setConnectionManager(poolingConnectionManager())
                .setKeepAliveStrategy(connectionKeepAliveStrategy())
                .build();
    }

    @Bean
    public PoolingHttpClientConnectionManager poolingConnectionManager() {
        PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(maxTotalConnections);
        manager.setDefaultMaxPerRoute(maxConnectionsPerRoute);
        manager.setValidateAfterInactivity(validateAfterInactivity);

        this.connectionManager = manager;
        return manager;
    }

    /**
     * Honors the server's keep-alive timeout when it sends one.
     */
    @Bean
    public ConnectionKeepAliveStrategy connectionKeepAliveStrategy() {
        return (response, context) -> {
            HeaderElementIterator it = new BasicHeaderElementIterator(
                    response.headerIterator(HTTP.CONN_KEEP_ALIVE));

            while (it.hasNext()) {
                HeaderElement he = it.nextElement();
                String value = he.getValue();
                if (value != null && he.getName().equalsIgnoreCase("timeout")) {
                    try {
                        return Long.parseLong(value) * 1000;
                    } catch (NumberFormatException e) {
                        logger.debug("Ignoring malformed keep-alive timeout '{}'", value);
                    }
                }
            }
            return defaultKeepAliveTime;
        };
    }

    /**
     * Closes expired and idle pooled connections.
     */
    @Scheduled(fixedRate = 30000)
    public void closeExpiredConnections() {
        if (connectionManager != null) {
            connectionManager.closeExpiredConnections();
            connectionManager.closeIdleConnections(60, TimeUnit.SECONDS);

            logger.debug("Webhook connection pool stats - Available: {}, Leased: {}, Pending: {}, Max: {}",
                    connectionManager.getTotalStats().getAvailable(),
                    connectionManager.getTotalStats().getLeased(),
                    connectionManager.getTotalStats().getPending(),
                    connectionManager.getTotalStats().getMax());
        }
    }

    /**
     * Treats every HTTP status as a regular response.
     */
    public static class PassThroughResponseErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // hasError is always false
        }
    }
}
