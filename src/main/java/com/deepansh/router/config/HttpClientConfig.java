package com.deepansh.router.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.async.CloseableHttpAsyncClient;
import org.apache.hc.client5.http.impl.async.HttpAsyncClients;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.http.client.reactive.HttpComponentsClientHttpConnector;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Pooled Apache HttpClient behind every outbound call: the classic client serves the
 * blocking RestClient (LLM completions, remote functions), the async client serves the
 * WebClient that reads streamed completions.
 *
 * The response timeout bounds the wait for the response head only; gaps between streamed
 * fragments are bounded by router.stream-idle-timeout-ms.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${http.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${http.read-timeout-ms:60000}")
    private long readTimeoutMs;

    @Value("${http.max-connections:50}")
    private int maxConnections;

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                        .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                        .build())
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, readTimeout={}ms, maxConnections={}]",
                connectTimeoutMs, readTimeoutMs, maxConnections);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    @Bean("llmWebClientBuilder")
    public WebClient.Builder llmWebClientBuilder() {
        CloseableHttpAsyncClient asyncClient = HttpAsyncClients.custom()
                .setConnectionManager(
                        PoolingAsyncClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                        .build())
                .build();

        return WebClient.builder().clientConnector(new HttpComponentsClientHttpConnector(asyncClient));
    }
}
