package com.example.autolist.dto;

import com.example.autolist.domain.PublishLedgerEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 게시 원장 조회 응답 (확인 토큰 원문은 노출하지 않음)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerEntryResponse {

    private String idempotencyKey;
    private String draftId;
    private boolean dryRun;
    private String status;
    private boolean needsManual;
    private String listingId;
    private String listingUrl;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;

    public static LedgerEntryResponse from(PublishLedgerEntry entry) {
        return LedgerEntryResponse.builder()
                .idempotencyKey(entry.getIdempotencyKey())
                .draftId(entry.getDraftId())
                .dryRun(entry.isDryRun())
                .status(entry.getStatus().name().toLowerCase())
                .needsManual(entry.isNeedsManual())
                .listingId(entry.getListingId())
                .listingUrl(entry.getListingUrl())
                .errorMessage(entry.getErrorMessage())
                .createdAt(entry.getCreatedAt())
                .completedAt(entry.getCompletedAt())
                .build();
    }
}
