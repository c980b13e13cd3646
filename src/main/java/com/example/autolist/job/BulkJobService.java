package com.example.autolist.job;

import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.domain.BulkJob;
import com.example.autolist.dto.BulkUploadResponse;
import com.example.autolist.dto.DraftResponse;
import com.example.autolist.dto.JobStatusResponse;
import com.example.autolist.exception.ResourceNotFoundException;
import com.example.autolist.service.DraftService;
import com.example.autolist.service.PhotoStorageService;
import com.example.autolist.service.QuotaService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * 벌크 업로드 접수 및 작업 상태 조회
 */
@Slf4j
@Service
public class BulkJobService {

    private final JobRegistry jobRegistry;
    private final QuotaService quotaService;
    private final PhotoStorageService photoStorageService;
    private final DraftService draftService;
    private final BulkJobRunner jobRunner;
    private final ThreadPoolTaskExecutor executor;

    public BulkJobService(JobRegistry jobRegistry,
                          QuotaService quotaService,
                          PhotoStorageService photoStorageService,
                          DraftService draftService,
                          BulkJobRunner jobRunner,
                          @Qualifier("bulkJobExecutor") ThreadPoolTaskExecutor executor) {
        this.jobRegistry = jobRegistry;
        this.quotaService = quotaService;
        this.photoStorageService = photoStorageService;
        this.draftService = draftService;
        this.jobRunner = jobRunner;
        this.executor = executor;
    }

    /**
     * 사진 업로드를 접수하고 백그라운드 작업을 시작합니다.
     *
     * @param photosPerItem 고정 그룹핑(autoGroup=false)일 때 상품당 사진 수
     */
    public BulkUploadResponse submit(String ownerId, List<MultipartFile> files,
                                     int photosPerItem, boolean autoGroup, String style) {
        validate(files, photosPerItem);

        int totalPhotos = files.size();
        long totalBytes = files.stream().mapToLong(MultipartFile::getSize).sum();
        int estimatedItems = Math.max(1, totalPhotos / photosPerItem);
        quotaService.checkUpload(ownerId, totalPhotos, totalBytes, estimatedItems);

        String jobId = jobRegistry.createJob(totalPhotos);
        List<String> photoPaths;
        try {
            photoPaths = photoStorageService.store(jobId, files);
        } catch (RuntimeException e) {
            jobRegistry.markFailed(jobId, "사진 저장 실패: " + e.getMessage());
            throw e;
        }

        BulkJobCommand command = BulkJobCommand.builder()
                .jobId(jobId)
                .ownerId(ownerId)
                .photoPaths(photoPaths)
                .autoGroup(autoGroup)
                .photosPerItem(photosPerItem)
                .style(style)
                .build();
        try {
            executor.execute(() -> jobRunner.run(command));
        } catch (TaskRejectedException e) {
            log.error("작업 큐가 가득 차 접수할 수 없음: jobId={}", jobId, e);
            jobRegistry.markFailed(jobId, "작업 큐가 가득 찼습니다. 잠시 후 다시 시도하세요.");
            throw e;
        }

        log.info("벌크 업로드 접수: jobId={}, ownerId={}, photos={}, autoGroup={}, photosPerItem={}",
                jobId, ownerId, totalPhotos, autoGroup, photosPerItem);
        return BulkUploadResponse.builder()
                .ok(true)
                .jobId(jobId)
                .totalPhotos(totalPhotos)
                .estimatedItems(estimatedItems)
                .status(BulkJob.JobStatus.QUEUED.name().toLowerCase())
                .message("사진 " + totalPhotos + "장 분석을 시작했습니다. 작업 상태 API로 진행률을 확인하세요.")
                .build();
    }

    public JobStatusResponse getStatus(String jobId) {
        BulkJob job = jobRegistry.getStatus(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("작업을 찾을 수 없습니다: " + jobId));
        List<DraftResponse> drafts = draftService.findAll(job.getDraftIds()).stream()
                .map(DraftResponse::from)
                .toList();
        return JobStatusResponse.from(job, drafts);
    }

    private static void validate(List<MultipartFile> files, int photosPerItem) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("업로드할 사진이 없습니다.");
        }
        if (files.size() > PipelineConstants.MAX_PHOTOS_PER_UPLOAD) {
            throw new IllegalArgumentException("사진은 최대 " + PipelineConstants.MAX_PHOTOS_PER_UPLOAD + "장까지 업로드할 수 있습니다.");
        }
        if (photosPerItem < PipelineConstants.MIN_PHOTOS_PER_ITEM || photosPerItem > PipelineConstants.MAX_PHOTOS_PER_ITEM) {
            throw new IllegalArgumentException("photosPerItem은 " + PipelineConstants.MIN_PHOTOS_PER_ITEM + "~"
                    + PipelineConstants.MAX_PHOTOS_PER_ITEM + " 사이여야 합니다: " + photosPerItem);
        }
        for (MultipartFile file : files) {
            String contentType = file.getContentType();
            if (contentType == null || !contentType.startsWith("image/")) {
                throw new IllegalArgumentException("이미지 파일만 업로드할 수 있습니다: " + file.getOriginalFilename());
            }
        }
    }
}
