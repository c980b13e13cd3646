package com.example.autolist.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 게시 결과
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PublishResult {

    private boolean ok;
    private boolean dryRun;
    private PublishOutcome outcome;
    private String listingId;
    private String listingUrl;
    private boolean needsManual;
    private String reason;
    private String idempotencyKey;

    public enum PublishOutcome {
        PUBLISHED,
        FAILED,
        NEEDS_MANUAL,
        DRY_RUN
    }

    public static PublishResult published(String idempotencyKey, String listingId, String listingUrl) {
        return PublishResult.builder()
                .ok(true)
                .outcome(PublishOutcome.PUBLISHED)
                .listingId(listingId)
                .listingUrl(listingUrl)
                .idempotencyKey(idempotencyKey)
                .build();
    }

    public static PublishResult dryRun(String idempotencyKey) {
        return PublishResult.builder()
                .ok(true)
                .dryRun(true)
                .outcome(PublishOutcome.DRY_RUN)
                .idempotencyKey(idempotencyKey)
                .build();
    }

    public static PublishResult needsManual(String idempotencyKey, String reason) {
        return PublishResult.builder()
                .ok(false)
                .outcome(PublishOutcome.NEEDS_MANUAL)
                .needsManual(true)
                .reason(reason)
                .idempotencyKey(idempotencyKey)
                .build();
    }

    public static PublishResult failed(String idempotencyKey, String reason) {
        return PublishResult.builder()
                .ok(false)
                .outcome(PublishOutcome.FAILED)
                .reason(reason)
                .idempotencyKey(idempotencyKey)
                .build();
    }
}
