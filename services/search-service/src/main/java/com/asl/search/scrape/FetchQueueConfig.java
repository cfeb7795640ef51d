package com.asl.search.scrape;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(FetchQueueProperties.class)
public class FetchQueueConfig {
    @Bean
    public RestTemplate fetchQueueRestTemplate(RestTemplateBuilder builder, FetchQueueProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .build();
    }

    @Bean
    public RestTemplate fetchQueueAwaitRestTemplate(RestTemplateBuilder builder, FetchQueueProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getAwaitReadTimeoutMs()))
            .build();
    }
}
