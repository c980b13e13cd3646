package com.example.autolist.service;

import com.example.autolist.config.PipelineProperties;
import com.example.autolist.exception.QuotaExceededException;
import com.example.autolist.repository.DraftRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

public class ConfiguredQuotaServiceTest {

    @Mock
    private DraftRepository draftRepository;

    private PipelineProperties properties;
    private ConfiguredQuotaService quotaService;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        properties = new PipelineProperties();
        quotaService = new ConfiguredQuotaService(properties, draftRepository);
    }

    @Test
    public void uploadWithinLimitsPasses() {
        when(draftRepository.countByOwnerId("owner-1")).thenReturn(10L);

        assertThatCode(() -> quotaService.checkUpload("owner-1", 20, 1_000_000L, 5)).doesNotThrowAnyException();
    }

    @Test
    public void photoCountLimit() {
        properties.getQuota().setMaxPhotosPerUpload(10);

        assertThatThrownBy(() -> quotaService.checkUpload("owner-1", 11, 1L, 1))
                .isInstanceOf(QuotaExceededException.class);
    }

    @Test
    public void uploadSizeLimit() {
        properties.getQuota().setMaxUploadBytes(100L);

        assertThatThrownBy(() -> quotaService.checkUpload("owner-1", 1, 101L, 1))
                .isInstanceOf(QuotaExceededException.class);
    }

    @Test
    public void draftCountLimitIncludesEstimatedItems() {
        properties.getQuota().setMaxDraftsPerOwner(100L);
        when(draftRepository.countByOwnerId("owner-1")).thenReturn(98L);

        assertThatThrownBy(() -> quotaService.checkUpload("owner-1", 12, 1L, 3))
                .isInstanceOf(QuotaExceededException.class)
                .hasMessageContaining("100");
    }
}
