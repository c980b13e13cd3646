package com.example.autolist.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 벌크 작업의 불변 스냅샷
 * <p>
 * 레지스트리는 변경 시마다 새 스냅샷으로 교체하므로, 조회 측은 잠금 없이 마지막으로 기록된 상태를 읽습니다.
 */
@Getter
@Builder(toBuilder = true)
public class BulkJob {

    private final String id;

    private final JobStatus status;

    private final int totalPhotos;

    private final int totalItems;

    private final int completedItems;

    private final int failedItems;

    private final double progressPercent;

    private final String phase;

    @Builder.Default
    private final List<String> draftIds = List.of();

    @Builder.Default
    private final List<String> errors = List.of();

    private final LocalDateTime createdAt;

    private final LocalDateTime startedAt;

    private final LocalDateTime completedAt;

    public boolean isTerminal() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    public enum JobStatus {
        QUEUED,
        PROCESSING,
        COMPLETED,
        FAILED
    }
}
