package com.deepansh.foundry.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient 5 backed RestClient builder for run/thread management
 * calls to the Foundry project endpoint. The MCP gateway has its own transport
 * (see McpGatewayClient).
 *
 * The builder is cloned by its consumer before customisation so base URLs
 * and default headers never leak between clients.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean("foundryRestClientBuilder")
    public RestClient.Builder foundryRestClientBuilder(FoundryProperties props) {
        log.info("Foundry HttpClient: connectTimeout={}ms readTimeout={}ms",
                props.getConnectTimeoutMs(), props.getReadTimeoutMs());
        return pooledBuilder(props.getConnectTimeoutMs(), props.getReadTimeoutMs());
    }

    private RestClient.Builder pooledBuilder(int connectTimeoutMs, int readTimeoutMs) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                        .build())
                .build();

        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
