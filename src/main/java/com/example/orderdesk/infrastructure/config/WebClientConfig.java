package com.example.orderdesk.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClients for the identity and notification collaborators.
 */
@Configuration
public class WebClientConfig {

    private static final int CONNECT_TIMEOUT_MS = 2000;

    @Bean
    public WebClient identityWebClient(
            WebClient.Builder builder,
            @Value("${services.identity.base-url:http://localhost:8091}") String baseUrl,
            @Value("${services.identity.timeout-ms:3000}") int timeoutMs) {
        return build(builder, baseUrl, timeoutMs);
    }

    @Bean
    public WebClient notificationWebClient(
            WebClient.Builder builder,
            @Value("${services.notification.base-url:http://localhost:8092}") String baseUrl,
            @Value("${services.notification.timeout-ms:5000}") int timeoutMs) {
        return build(builder, baseUrl, timeoutMs);
    }

    private WebClient build(WebClient.Builder builder, String baseUrl, int timeoutMs) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(Duration.ofMillis(timeoutMs))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        // each collaborator gets its own builder copy so base urls do not leak between clients
        return builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
