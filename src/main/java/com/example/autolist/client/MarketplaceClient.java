package com.example.autolist.client;

import com.example.autolist.dto.ListingSnapshot;

/**
 * 마켓플레이스 게시 클라이언트
 */
public interface MarketplaceClient {

    /**
     * 리스팅 게시
     *
     * @throws com.example.autolist.exception.ExternalServiceException 통신 실패 또는 서버 오류 시
     */
    MarketplacePublishResult publish(ListingSnapshot listing);
}
