package com.example.autolist.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 마켓플레이스 게시 결과
 */
@Getter
@Builder
@AllArgsConstructor
public class MarketplacePublishResult {

    private final Outcome outcome;
    private final String listingId;
    private final String listingUrl;
    private final String errorMessage;

    public enum Outcome {
        PUBLISHED,
        FAILED,
        NEEDS_MANUAL // 캡차/본인확인 등 사람이 처리해야 하는 경우
    }

    public static MarketplacePublishResult published(String listingId, String listingUrl) {
        return new MarketplacePublishResult(Outcome.PUBLISHED, listingId, listingUrl, null);
    }

    public static MarketplacePublishResult failed(String errorMessage) {
        return new MarketplacePublishResult(Outcome.FAILED, null, null, errorMessage);
    }

    public static MarketplacePublishResult needsManual(String reason) {
        return new MarketplacePublishResult(Outcome.NEEDS_MANUAL, null, null, reason);
    }
}
