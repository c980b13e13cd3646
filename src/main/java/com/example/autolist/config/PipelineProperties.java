package com.example.autolist.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 벌크 리스팅 파이프라인 설정 프로퍼티
 * <p>
 * 분류 배치 크기, 중복 판정 임계값, 확인 토큰 TTL 등 원본 코드에 하드코딩되어 있던
 * 상수들을 모두 설정으로 노출합니다.
 */
@Component
@Getter
@Setter
@ConfigurationProperties(prefix = "bulk")
public class PipelineProperties {

    private final Grouping grouping = new Grouping();
    private final Dedup dedup = new Dedup();
    private final Publish publish = new Publish();
    private final Executor executor = new Executor();
    private final Storage storage = new Storage();
    private final Quota quota = new Quota();
    private final Classifier classifier = new Classifier();

    @Getter
    @Setter
    public static class Grouping {
        /**
         * 분류기 1회 호출당 최대 사진 수
         */
        private int batchLimit = 25;

        /**
         * 분류 실패 시 단순 분할에 사용하는 그룹 크기
         */
        private int fallbackGroupSize = 7;

        /**
         * 이 값 이하의 사진을 가진 그룹은 가장 큰 그룹에 병합 (0이면 비활성화)
         */
        private int smallGroupMergeThreshold = 2;

        private String defaultStyle = "classique";
    }

    @Getter
    @Setter
    public static class Dedup {
        /**
         * 제목 유사도 임계값 (0~100)
         */
        private double titleThreshold = 85.0;

        /**
         * 같은 사진으로 간주할 perceptual hash 해밍 거리 (0 = 완전 일치)
         */
        private int hashDistance = 0;
    }

    @Getter
    @Setter
    public static class Publish {
        /**
         * 확인 토큰 HMAC 서명 키 (최소 32바이트)
         */
        private String tokenSecret;

        private Duration tokenTtl = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
    }

    @Getter
    @Setter
    public static class Storage {
        private String uploadDir = "data/uploads";

        /**
         * 초안 저장 실패 시 재시도 횟수 (최초 시도 포함)
         */
        private int saveAttempts = 3;
    }

    @Getter
    @Setter
    public static class Quota {
        private int maxPhotosPerUpload = 500;
        private long maxUploadBytes = 500L * 1024 * 1024;
        private long maxDraftsPerOwner = 5000;
    }

    @Getter
    @Setter
    public static class Classifier {
        private String baseUrl = "http://localhost:8090";
        private Duration timeout = Duration.ofSeconds(90);
    }
}
