package com.example.autolist.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 벌크 업로드 접수 응답
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkUploadResponse {

    private boolean ok;
    private String jobId;
    private int totalPhotos;
    private int estimatedItems;
    private String status;
    private String message;
}
