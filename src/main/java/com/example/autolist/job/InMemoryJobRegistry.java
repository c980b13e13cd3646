package com.example.autolist.job;

import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.domain.BulkJob;
import com.example.autolist.domain.BulkJob.JobStatus;
import com.example.autolist.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 메모리 기반 작업 레지스트리
 * <p>
 * 작업마다 불변 스냅샷을 AtomicReference에 담아 두고 갱신 시 통째로 교체합니다.
 * 조회는 잠금 없이 마지막 스냅샷을 읽습니다. 프로세스 재시작 시 작업 정보는 사라집니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryJobRegistry implements JobRegistry {

    private final Map<String, AtomicReference<BulkJob>> jobs = new ConcurrentHashMap<>();

    private final Clock clock;

    @Override
    public String createJob(int totalPhotos) {
        String jobId = UUID.randomUUID().toString();
        BulkJob job = BulkJob.builder()
                .id(jobId)
                .status(JobStatus.QUEUED)
                .totalPhotos(totalPhotos)
                .progressPercent(0.0)
                .phase(PipelineConstants.PHASE_QUEUED)
                .createdAt(now())
                .build();
        jobs.put(jobId, new AtomicReference<>(job));
        log.info("벌크 작업 생성: jobId={}, totalPhotos={}", jobId, totalPhotos);
        return jobId;
    }

    @Override
    public void startProcessing(String jobId) {
        update(jobId, job -> {
            if (job.getStatus() != JobStatus.QUEUED) {
                throw new IllegalStateException("대기 상태가 아닌 작업은 시작할 수 없습니다: " + jobId + " (" + job.getStatus() + ")");
            }
            return job.toBuilder()
                    .status(JobStatus.PROCESSING)
                    .startedAt(now())
                    .build();
        });
    }

    @Override
    public void setTotalItems(String jobId, int totalItems) {
        if (totalItems < 0) {
            throw new IllegalArgumentException("totalItems는 0 이상이어야 합니다: " + totalItems);
        }
        update(jobId, job -> job.toBuilder().totalItems(totalItems).build());
    }

    @Override
    public void updateProgress(String jobId, double percent, String phase) {
        update(jobId, job -> {
            double capped = Math.min(percent, PipelineConstants.MAX_RUNNING_PROGRESS);
            double next = Math.max(job.getProgressPercent(), capped);
            return job.toBuilder()
                    .progressPercent(next)
                    .phase(phase != null ? phase : job.getPhase())
                    .build();
        });
    }

    @Override
    public void recordDraft(String jobId, String draftId, boolean fallback) {
        update(jobId, job -> {
            List<String> draftIds = job.getDraftIds();
            if (!draftIds.contains(draftId)) {
                draftIds = append(draftIds, draftId);
            }
            BulkJob.BulkJobBuilder builder = job.toBuilder().draftIds(draftIds);
            if (fallback) {
                builder.failedItems(job.getFailedItems() + 1);
            } else {
                builder.completedItems(job.getCompletedItems() + 1);
            }
            return builder.build();
        });
    }

    @Override
    public void recordItemFailure(String jobId, String error) {
        update(jobId, job -> job.toBuilder()
                .failedItems(job.getFailedItems() + 1)
                .errors(append(job.getErrors(), error))
                .build());
    }

    @Override
    public void recordError(String jobId, String error) {
        update(jobId, job -> job.toBuilder()
                .errors(append(job.getErrors(), error))
                .build());
    }

    @Override
    public void markCompleted(String jobId, List<String> producedDrafts) {
        BulkJob completed = update(jobId, job -> {
            if (job.getStatus() != JobStatus.PROCESSING) {
                throw new IllegalStateException("처리 중이 아닌 작업은 완료 처리할 수 없습니다: " + jobId + " (" + job.getStatus() + ")");
            }
            // 병합으로 같은 초안이 여러 번 나올 수 있으므로 순서를 유지하며 중복 제거
            LinkedHashSet<String> ids = new LinkedHashSet<>(job.getDraftIds());
            ids.addAll(producedDrafts);
            return job.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .draftIds(List.copyOf(ids))
                    .progressPercent(PipelineConstants.COMPLETED_PROGRESS)
                    .phase(PipelineConstants.PHASE_COMPLETED)
                    .completedAt(now())
                    .build();
        });
        log.info("벌크 작업 완료: jobId={}, drafts={}, completedItems={}, failedItems={}",
                jobId, completed.getDraftIds().size(), completed.getCompletedItems(), completed.getFailedItems());
    }

    @Override
    public void markFailed(String jobId, String error) {
        update(jobId, job -> job.toBuilder()
                .status(JobStatus.FAILED)
                .phase(PipelineConstants.PHASE_FAILED)
                .errors(append(job.getErrors(), error))
                .completedAt(now())
                .build());
        log.warn("벌크 작업 실패: jobId={}, error={}", jobId, error);
    }

    @Override
    public Optional<BulkJob> getStatus(String jobId) {
        AtomicReference<BulkJob> ref = jobs.get(jobId);
        return ref == null ? Optional.empty() : Optional.of(ref.get());
    }

    private BulkJob update(String jobId, UnaryOperator<BulkJob> mutation) {
        AtomicReference<BulkJob> ref = jobs.get(jobId);
        if (ref == null) {
            throw new ResourceNotFoundException("작업을 찾을 수 없습니다: " + jobId);
        }
        return ref.updateAndGet(job -> {
            if (job.isTerminal()) {
                throw new IllegalStateException("이미 종료된 작업입니다: " + jobId + " (" + job.getStatus() + ")");
            }
            return mutation.apply(job);
        });
    }

    private static List<String> append(List<String> source, String value) {
        List<String> copy = new ArrayList<>(source);
        copy.add(value != null ? value : "알 수 없는 오류");
        return List.copyOf(copy);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
