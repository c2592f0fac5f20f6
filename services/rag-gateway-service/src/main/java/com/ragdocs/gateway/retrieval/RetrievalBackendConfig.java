package com.ragdocs.gateway.retrieval;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(RetrievalBackendProperties.class)
public class RetrievalBackendConfig {

    @Bean
    public RestTemplate retrievalRestTemplate(RestTemplateBuilder builder, RetrievalBackendProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
    }

    @Bean
    public RestTemplate retrievalHealthRestTemplate(RestTemplateBuilder builder, RetrievalBackendProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getHealthTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getHealthTimeoutMs()))
            .build();
    }
}
