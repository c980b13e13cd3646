package com.example.autolist.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 게시 준비 결과
 * ok=false이면 reasons에 품질 게이트 실패 사유가 들어가며 어떤 상태도 변경되지 않습니다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrepareResult {

    private boolean ok;
    private boolean dryRun;
    private String confirmToken;
    private Instant expiresAt;

    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    private ListingSnapshot snapshot;

    public static PrepareResult notReady(ListingSnapshot snapshot, List<String> reasons) {
        return PrepareResult.builder()
                .ok(false)
                .reasons(List.copyOf(reasons))
                .snapshot(snapshot)
                .build();
    }

    public static PrepareResult ready(ListingSnapshot snapshot, String confirmToken, Instant expiresAt,
                                      boolean dryRun, List<String> reasons) {
        return PrepareResult.builder()
                .ok(true)
                .dryRun(dryRun)
                .confirmToken(confirmToken)
                .expiresAt(expiresAt)
                .reasons(List.copyOf(reasons))
                .snapshot(snapshot)
                .build();
    }
}
