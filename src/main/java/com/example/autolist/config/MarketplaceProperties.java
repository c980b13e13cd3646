package com.example.autolist.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 마켓플레이스 API 설정 프로퍼티
 */
@Component
@Getter
@Setter
@ConfigurationProperties(prefix = "marketplace")
public class MarketplaceProperties {

    private String clientId;
    private String clientSecret; // bcrypt salt 문자열
    private String apiBaseUrl;
    private Duration timeout = Duration.ofSeconds(60);
}
