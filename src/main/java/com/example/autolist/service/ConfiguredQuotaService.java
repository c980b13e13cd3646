package com.example.autolist.service;

import com.example.autolist.config.PipelineProperties;
import com.example.autolist.exception.QuotaExceededException;
import com.example.autolist.repository.DraftRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 설정값(bulk.quota.*) 기반 한도 점검
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfiguredQuotaService implements QuotaService {

    private final PipelineProperties properties;
    private final DraftRepository draftRepository;

    @Override
    public void checkUpload(String ownerId, int photoCount, long totalBytes, int estimatedItems) {
        PipelineProperties.Quota quota = properties.getQuota();

        if (photoCount > quota.getMaxPhotosPerUpload()) {
            log.warn("사진 수 한도 초과: ownerId={}, photos={}", ownerId, photoCount);
            throw new QuotaExceededException("업로드 사진 수", quota.getMaxPhotosPerUpload());
        }
        if (totalBytes > quota.getMaxUploadBytes()) {
            log.warn("업로드 용량 한도 초과: ownerId={}, bytes={}", ownerId, totalBytes);
            throw new QuotaExceededException("업로드 용량(bytes)", quota.getMaxUploadBytes());
        }
        long drafts = draftRepository.countByOwnerId(ownerId);
        if (drafts + estimatedItems > quota.getMaxDraftsPerOwner()) {
            log.warn("초안 수 한도 초과: ownerId={}, drafts={}, estimated={}", ownerId, drafts, estimatedItems);
            throw new QuotaExceededException("초안 수", quota.getMaxDraftsPerOwner());
        }
    }
}
