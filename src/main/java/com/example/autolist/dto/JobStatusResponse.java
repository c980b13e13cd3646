package com.example.autolist.dto;

import com.example.autolist.domain.BulkJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 벌크 작업 상태 응답 (레지스트리 스냅샷의 읽기 전용 투영)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobStatusResponse {

    private String jobId;
    private String status;
    private String phase;
    private double progressPercent;
    private int totalPhotos;
    private int totalItems;
    private int completedItems;
    private int failedItems;
    private List<DraftResponse> drafts;
    private List<String> errors;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public static JobStatusResponse from(BulkJob job, List<DraftResponse> drafts) {
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus().name().toLowerCase())
                .phase(job.getPhase())
                .progressPercent(job.getProgressPercent())
                .totalPhotos(job.getTotalPhotos())
                .totalItems(job.getTotalItems())
                .completedItems(job.getCompletedItems())
                .failedItems(job.getFailedItems())
                .drafts(drafts)
                .errors(job.getErrors())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
