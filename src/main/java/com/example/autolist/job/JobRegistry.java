package com.example.autolist.job;

import com.example.autolist.domain.BulkJob;

import java.util.List;
import java.util.Optional;

/**
 * 벌크 작업 생명주기/진행률 저장소
 * <p>
 * 상태 전이: QUEUED → PROCESSING → {COMPLETED | FAILED}, QUEUED → FAILED.
 * 종료 상태의 작업에 대한 쓰기는 {@link IllegalStateException}을 던지고,
 * 알 수 없는 작업 ID는 {@link com.example.autolist.exception.ResourceNotFoundException}을 던집니다.
 */
public interface JobRegistry {

    String createJob(int totalPhotos);

    void startProcessing(String jobId);

    void setTotalItems(String jobId, int totalItems);

    /**
     * 진행률 갱신. 마지막 기록값보다 낮은 값은 무시되고 완료 전에는 99%를 넘지 않습니다.
     */
    void updateProgress(String jobId, double percent, String phase);

    /**
     * 생성(또는 병합)된 초안 기록
     *
     * @param fallback 분류 실패로 기본값이 채워진 초안이면 true (실패 항목으로 집계)
     */
    void recordDraft(String jobId, String draftId, boolean fallback);

    void recordItemFailure(String jobId, String error);

    void recordError(String jobId, String error);

    void markCompleted(String jobId, List<String> producedDrafts);

    void markFailed(String jobId, String error);

    Optional<BulkJob> getStatus(String jobId);
}
