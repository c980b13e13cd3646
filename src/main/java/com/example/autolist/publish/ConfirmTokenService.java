package com.example.autolist.publish;

import com.example.autolist.config.PipelineProperties;
import com.example.autolist.dto.ListingSnapshot;
import com.example.autolist.exception.ExpiredTokenException;
import com.example.autolist.exception.InvalidTokenException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 게시 확인 토큰 발급/검증 (HMAC-SHA256 JWT)
 * <p>
 * 토큰에는 리스팅 스냅샷(JSON)과 발급 시각(issued_at, epoch millis)이 서명되어 들어가며
 * 서버에는 아무것도 저장하지 않습니다. 유효성은 (토큰, 키, 현재 시각)만으로 결정됩니다.
 */
@Slf4j
@Component
public class ConfirmTokenService {

    static final String SNAPSHOT_CLAIM = "snapshot";
    static final String ISSUED_AT_CLAIM = "issued_at";
    static final String DRY_RUN_CLAIM = "dry_run";

    private static final int MIN_SECRET_BYTES = 32;

    private final Key signingKey;
    private final Duration ttl;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ConfirmTokenService(PipelineProperties properties, ObjectMapper objectMapper, Clock clock) {
        String secret = properties.getPublish().getTokenSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("bulk.publish.token-secret이 설정되지 않았습니다.");
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("bulk.publish.token-secret은 최소 " + MIN_SECRET_BYTES + "바이트여야 합니다.");
        }
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
        this.ttl = properties.getPublish().getTokenTtl();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public IssuedToken issue(ListingSnapshot snapshot, boolean dryRun) {
        Instant issuedAt = clock.instant();
        String snapshotJson;
        try {
            snapshotJson = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("리스팅 스냅샷을 직렬화할 수 없습니다.", e);
        }

        String token = Jwts.builder()
                .claim(SNAPSHOT_CLAIM, snapshotJson)
                .claim(ISSUED_AT_CLAIM, issuedAt.toEpochMilli())
                .claim(DRY_RUN_CLAIM, dryRun)
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedToken(token, issuedAt, issuedAt.plus(ttl));
    }

    /**
     * 서명과 만료 검증
     *
     * @throws InvalidTokenException 서명 불일치, 형식 오류
     * @throws ExpiredTokenException 발급 후 TTL 경과
     */
    public VerifiedToken verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("확인 토큰이 비어 있습니다.");
        }

        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("확인 토큰 검증 실패: {}", e.getMessage());
            throw new InvalidTokenException("확인 토큰이 유효하지 않습니다.", e);
        }

        Long issuedAtMillis = claims.get(ISSUED_AT_CLAIM, Long.class);
        String snapshotJson = claims.get(SNAPSHOT_CLAIM, String.class);
        if (issuedAtMillis == null || snapshotJson == null) {
            throw new InvalidTokenException("확인 토큰에 필수 항목이 없습니다.");
        }

        Instant issuedAt = Instant.ofEpochMilli(issuedAtMillis);
        Duration age = Duration.between(issuedAt, clock.instant());
        if (age.compareTo(ttl) > 0) {
            throw new ExpiredTokenException("확인 토큰이 만료되었습니다. 게시 준비를 다시 진행하세요.");
        }

        ListingSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(snapshotJson, ListingSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new InvalidTokenException("확인 토큰의 리스팅 정보를 해석할 수 없습니다.", e);
        }

        boolean dryRun = Boolean.TRUE.equals(claims.get(DRY_RUN_CLAIM, Boolean.class));
        return new VerifiedToken(snapshot, dryRun, issuedAt);
    }

    @Getter
    @AllArgsConstructor
    public static class IssuedToken {
        private final String token;
        private final Instant issuedAt;
        private final Instant expiresAt;
    }

    @Getter
    @AllArgsConstructor
    public static class VerifiedToken {
        private final ListingSnapshot snapshot;
        private final boolean dryRun;
        private final Instant issuedAt;
    }
}
