package com.apichat.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * A Spring configuration class responsible for creating the shared HTTP client.
 * <p>
 * Both the reasoning backends and the remote APIs are called through this client. It carries
 * no retry filter: a failed call is reported to the caller, never re-attempted. Call timeouts
 * are applied per request by the services that use it.
 */
@Configuration
public class HttpClientFactory {

    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    /**
     * Creates the WebClient used for every outbound call.
     *
     * @param connectTimeout Upper bound for establishing a TCP connection.
     * @return A configured {@link WebClient}.
     */
    @Bean
    public WebClient webClient(@Value("${agent.http.connect-timeout:10s}") Duration connectTimeout) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                        .build())
                .build();
    }
}
