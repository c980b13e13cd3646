package com.example.autolist.service;

/**
 * 업로드 전 용량/한도 사전 점검
 */
public interface QuotaService {

    /**
     * @throws com.example.autolist.exception.QuotaExceededException 한도를 넘는 경우
     */
    void checkUpload(String ownerId, int photoCount, long totalBytes, int estimatedItems);
}
