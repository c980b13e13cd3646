package com.example.autolist.client;

import com.example.autolist.config.MarketplaceProperties;
import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.dto.ListingSnapshot;
import com.example.autolist.exception.ExternalServiceException;
import com.example.autolist.util.SignatureUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.util.Map;

/**
 * 마켓플레이스 HTTP 게시 클라이언트
 * <p>
 * 요청마다 client_id + timestamp 기반 bcrypt 서명을 헤더에 실어 보냅니다.
 * 403 또는 challenge 응답은 수동 처리 필요로, 그 외 4xx는 게시 실패로 변환하고
 * 5xx와 통신 오류는 {@link ExternalServiceException}으로 던집니다.
 */
@Slf4j
@Component
public class HttpMarketplaceClient implements MarketplaceClient {

    static final String LISTINGS_PATH = "/v1/listings";
    static final String CLIENT_ID_HEADER = "X-Client-Id";
    static final String TIMESTAMP_HEADER = "X-Timestamp";
    static final String SIGNATURE_HEADER = "X-Client-Signature";

    private final WebClient webClient;
    private final MarketplaceProperties properties;
    private final Clock clock;

    public HttpMarketplaceClient(@Qualifier("marketplaceWebClient") WebClient webClient,
                                 MarketplaceProperties properties,
                                 Clock clock) {
        this.webClient = webClient;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public MarketplacePublishResult publish(ListingSnapshot listing) {
        long timestamp = clock.millis();
        String signature = SignatureUtil.generateSignature(
                properties.getClientId(),
                timestamp,
                properties.getClientSecret()
        );

        log.info("마켓플레이스 게시 요청: draftId={}, title={}", listing.getDraftId(), listing.getTitle());

        Map<String, Object> response;
        try {
            response = webClient.post()
                    .uri(LISTINGS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(CLIENT_ID_HEADER, properties.getClientId())
                    .header(TIMESTAMP_HEADER, String.valueOf(timestamp))
                    .header(SIGNATURE_HEADER, signature)
                    .bodyValue(listing)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {
                    })
                    .block(properties.getTimeout());
        } catch (WebClientResponseException e) {
            return fromErrorResponse(e);
        } catch (RuntimeException e) {
            log.error("마켓플레이스 통신 실패: {}", e.getMessage());
            throw new ExternalServiceException("마켓플레이스 통신 실패: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ExternalServiceException("마켓플레이스 응답이 비어 있습니다.");
        }
        if (Boolean.TRUE.equals(response.get("challenge"))) {
            log.warn("마켓플레이스 본인확인 요구: draftId={}", listing.getDraftId());
            return MarketplacePublishResult.needsManual(PipelineConstants.NEEDS_MANUAL_REASON);
        }

        Object listingId = response.get("id");
        if (listingId == null) {
            return MarketplacePublishResult.failed("마켓플레이스 응답에 리스팅 ID가 없습니다.");
        }
        Object url = response.get("url");
        log.info("마켓플레이스 게시 성공: listingId={}", listingId);
        return MarketplacePublishResult.published(String.valueOf(listingId), url != null ? String.valueOf(url) : null);
    }

    private MarketplacePublishResult fromErrorResponse(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        if (status == 403) {
            log.warn("마켓플레이스 접근 거부 (캡차/본인확인 추정): body={}", body);
            return MarketplacePublishResult.needsManual(PipelineConstants.NEEDS_MANUAL_REASON);
        }
        if (e.getStatusCode().is4xxClientError()) {
            log.warn("마켓플레이스 게시 거절: status={}, body={}", status, body);
            return MarketplacePublishResult.failed("마켓플레이스 게시 거절 (" + status + "): " + body);
        }
        log.error("마켓플레이스 서버 오류: status={}, body={}", status, body);
        throw new ExternalServiceException("마켓플레이스 서버 오류: " + status, e);
    }
}
