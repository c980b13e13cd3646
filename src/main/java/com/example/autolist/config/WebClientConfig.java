package com.example.autolist.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 외부 API(분류기, 마켓플레이스) 호출을 위한 WebClient 설정
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(10 * 1024 * 1024)) // 10MB
                .defaultHeader("Content-Type", "application/json");
    }

    @Bean
    @Qualifier("classifierWebClient")
    public WebClient classifierWebClient(WebClient.Builder builder, PipelineProperties properties) {
        // 공유 빌더를 변경하지 않도록 복제 후 baseUrl 지정
        return builder.clone()
                .baseUrl(properties.getClassifier().getBaseUrl())
                .build();
    }

    @Bean
    @Qualifier("marketplaceWebClient")
    public WebClient marketplaceWebClient(WebClient.Builder builder, MarketplaceProperties properties) {
        return builder.clone()
                .baseUrl(properties.getApiBaseUrl())
                .build();
    }
}
