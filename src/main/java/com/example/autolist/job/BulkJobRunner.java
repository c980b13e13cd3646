package com.example.autolist.job;

import com.example.autolist.config.PipelineProperties;
import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.domain.Draft;
import com.example.autolist.dto.GroupingResult;
import com.example.autolist.dto.ItemDescriptor;
import com.example.autolist.dto.ResolvedDraft;
import com.example.autolist.exception.StorageException;
import com.example.autolist.service.DraftContentBuilder;
import com.example.autolist.service.DraftStore;
import com.example.autolist.service.PhotoGroupingAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 벌크 작업 본체 (백그라운드 스레드에서 실행)
 * <p>
 * 그룹핑 → 상품별 초안 저장(중복이면 병합) → 완료 순서로 진행하며,
 * 이 작업이 해당 작업 레지스트리 항목의 유일한 writer입니다.
 * 도중에 예외가 나면 작업은 FAILED가 되지만 이미 만든 초안과 진행률은 유지됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BulkJobRunner {

    private static final long RETRY_BACKOFF_MILLIS = 200L;

    private final JobRegistry jobRegistry;
    private final PhotoGroupingAdapter groupingAdapter;
    private final DraftContentBuilder contentBuilder;
    private final DraftStore draftStore;
    private final PipelineProperties properties;

    public void run(BulkJobCommand command) {
        String jobId = command.getJobId();
        List<String> produced = new ArrayList<>();

        try {
            jobRegistry.startProcessing(jobId);
            jobRegistry.updateProgress(jobId, PipelineConstants.GROUPING_STARTED_PROGRESS, PipelineConstants.PHASE_GROUPING);

            GroupingResult grouping = groupingAdapter.groupAndClassify(
                    command.getPhotoPaths(), command.getStyle(), command.isAutoGroup(), command.getPhotosPerItem());
            grouping.getErrors().forEach(error -> jobRegistry.recordError(jobId, error));

            List<ItemDescriptor> items = grouping.getDescriptors();
            jobRegistry.setTotalItems(jobId, items.size());
            jobRegistry.updateProgress(jobId, PipelineConstants.GROUPING_DONE_PROGRESS, PipelineConstants.PHASE_DRAFTING);
            log.info("그룹핑 완료: jobId={}, photos={}, items={}", jobId, command.getPhotoPaths().size(), items.size());

            double span = PipelineConstants.MAX_RUNNING_PROGRESS - PipelineConstants.GROUPING_DONE_PROGRESS;
            for (int i = 0; i < items.size(); i++) {
                ItemDescriptor item = items.get(i);
                Draft candidate;
                try {
                    candidate = contentBuilder.build(item, command.getOwnerId(), jobId);
                } catch (RuntimeException e) {
                    log.warn("상품 {}번 초안 생성 실패: jobId={}, error={}", i + 1, jobId, e.getMessage());
                    jobRegistry.recordItemFailure(jobId, "상품 " + (i + 1) + " 초안 생성 실패: " + e.getMessage());
                    continue;
                }

                ResolvedDraft resolved = saveWithRetry(jobId, candidate);
                jobRegistry.recordDraft(jobId, resolved.getId(), item.isFallback());
                if (!produced.contains(resolved.getId())) {
                    produced.add(resolved.getId());
                }

                double progress = PipelineConstants.GROUPING_DONE_PROGRESS + span * (i + 1) / items.size();
                jobRegistry.updateProgress(jobId, progress, PipelineConstants.PHASE_DRAFTING);
            }

            jobRegistry.markCompleted(jobId, produced);
        } catch (Exception e) {
            log.error("벌크 작업 실패: jobId={}", jobId, e);
            failQuietly(jobId, e);
        }
    }

    private ResolvedDraft saveWithRetry(String jobId, Draft candidate) {
        int attempts = Math.max(1, properties.getStorage().getSaveAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return draftStore.saveDraft(candidate);
            } catch (StorageException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.warn("초안 저장 재시도 {}/{}: jobId={}, error={}", attempt, attempts, jobId, e.getMessage());
                sleep(RETRY_BACKOFF_MILLIS * attempt, e);
            }
        }
    }

    private void failQuietly(String jobId, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            jobRegistry.markFailed(jobId, message);
        } catch (IllegalStateException e) {
            // 이미 종료된 작업 (완료 처리 직후의 예외 등)
            log.warn("작업 실패 상태 기록 불가: jobId={}, reason={}", jobId, e.getMessage());
        }
    }

    private static void sleep(long millis, StorageException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
