package ru.javaboys.huntymatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class PineconeClientConfig {

    @Bean
    public WebClient pineconeWebClient(
            @Value("${hunty.pinecone.index-host}") String indexHost,
            @Value("${hunty.pinecone.api-key}") String apiKey,
            @Value("${hunty.pinecone.timeout-seconds:10}") long timeoutSeconds
    ) {
        return WebClient.builder()
                .baseUrl(indexHost)
                .defaultHeader("Api-Key", apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create().responseTimeout(Duration.ofSeconds(timeoutSeconds))))
                // 1536-dim upserts in chunks of 100 are several MB
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }
}
