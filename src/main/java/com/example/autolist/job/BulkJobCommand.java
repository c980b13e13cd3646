package com.example.autolist.job;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 백그라운드 작업 실행 입력
 */
@Getter
@Builder
public class BulkJobCommand {

    private final String jobId;
    private final String ownerId;
    private final List<String> photoPaths;
    private final boolean autoGroup;
    private final int photosPerItem;
    private final String style;
}
