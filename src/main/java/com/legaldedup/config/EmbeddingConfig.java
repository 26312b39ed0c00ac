package com.legaldedup.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@Getter
public class EmbeddingConfig {

    @Value("${legal-dedup.embedding.dimension:384}")
    private Integer dimension;

    @Value("${legal-dedup.embedding.timeout-seconds:8}")
    private Integer timeoutSeconds;

    @Value("${legal-dedup.embedding.base-url:http://localhost:8000}")
    private String baseUrl;

    @Value("${legal-dedup.embedding.max-in-memory-size-kb:1024}")
    private Integer maxInMemorySizeKb;

    @Bean
    public WebClient embeddingWebClient() {
        log.info("==============================================");
        log.info("EMBEDDING SERVICE CONFIGURATION");
        log.info("==============================================");
        log.info("  Base URL  : {}", baseUrl);
        log.info("  Dimension : {}", dimension);
        log.info("  Timeout   : {}s", timeoutSeconds);
        log.info("==============================================");

        return WebClient.builder()
                .baseUrl(baseUrl)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySizeKb * 1024))
                .clientConnector(
                        new ReactorClientHttpConnector(
                                HttpClient.create()
                                        .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                        )
                )
                .build();
    }
}
