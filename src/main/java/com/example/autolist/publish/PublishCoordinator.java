package com.example.autolist.publish;

import com.example.autolist.client.MarketplaceClient;
import com.example.autolist.client.MarketplacePublishResult;
import com.example.autolist.domain.Draft;
import com.example.autolist.domain.PublishLedgerEntry;
import com.example.autolist.dto.ListingSnapshot;
import com.example.autolist.dto.PrepareRequest;
import com.example.autolist.dto.PrepareResult;
import com.example.autolist.dto.PublishResult;
import com.example.autolist.exception.ConflictException;
import com.example.autolist.exception.ExpiredTokenException;
import com.example.autolist.exception.ExternalServiceException;
import com.example.autolist.exception.InvalidTokenException;
import com.example.autolist.repository.PublishLedgerRepository;
import com.example.autolist.service.DraftService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 2단계 게시 (prepare → publish)
 * <p>
 * prepare는 상태를 바꾸지 않고 품질 점검 후 서명된 확인 토큰만 돌려줍니다.
 * publish는 멱등성 키를 원장에 먼저 예약한 뒤에만 외부 호출을 하므로,
 * 같은 키로 몇 번을 호출하든 마켓플레이스 호출은 최대 한 번입니다.
 * 실패한 게시는 자동으로 재시도하지 않으며 새 키가 필요합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublishCoordinator {

    private final QualityGate qualityGate;
    private final ConfirmTokenService tokenService;
    private final PublishLedgerWriter ledgerWriter;
    private final PublishLedgerRepository ledgerRepository;
    private final MarketplaceClient marketplaceClient;
    private final DraftService draftService;

    /**
     * 게시 준비 (Phase A)
     */
    public PrepareResult prepare(String ownerId, PrepareRequest request) {
        ListingSnapshot snapshot = snapshotOf(ownerId, request);
        List<String> reasons = qualityGate.evaluate(snapshot);

        if (!reasons.isEmpty() && !request.isDryRun()) {
            log.info("게시 준비 불가: draftId={}, reasons={}", snapshot.getDraftId(), reasons);
            return PrepareResult.notReady(snapshot, reasons);
        }

        ConfirmTokenService.IssuedToken issued = tokenService.issue(snapshot, request.isDryRun());
        log.info("확인 토큰 발급: draftId={}, dryRun={}, expiresAt={}", snapshot.getDraftId(), request.isDryRun(), issued.getExpiresAt());
        return PrepareResult.ready(snapshot, issued.getToken(), issued.getExpiresAt(), request.isDryRun(), reasons);
    }

    /**
     * 게시 (Phase B)
     *
     * @throws IllegalArgumentException  멱등성 키가 없는 경우
     * @throws ConflictException         이미 사용된 멱등성 키
     * @throws InvalidTokenException     토큰 위조/형식 오류, 또는 dry-run 토큰으로 실제 게시 시도
     * @throws ExpiredTokenException     토큰 만료
     * @throws ExternalServiceException  마켓플레이스 통신 실패
     */
    public PublishResult publish(String confirmToken, String idempotencyKey, boolean dryRun) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency-Key 헤더가 필요합니다.");
        }
        String key = idempotencyKey.trim();

        try {
            ledgerWriter.reserve(key, confirmToken == null ? "" : confirmToken, dryRun);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // 잠금 대기 초과도 같은 키를 다른 요청이 예약 중이라는 뜻
            throw new ConflictException(key);
        }

        ConfirmTokenService.VerifiedToken verified;
        try {
            verified = tokenService.verify(confirmToken);
            if (verified.isDryRun() && !dryRun) {
                throw new InvalidTokenException("dry-run으로 발급된 토큰으로는 실제 게시를 할 수 없습니다.");
            }
        } catch (InvalidTokenException | ExpiredTokenException e) {
            ledgerWriter.markFailed(key, null, e.getMessage(), false);
            throw e;
        }

        ListingSnapshot listing = verified.getSnapshot();
        String draftId = listing.getDraftId();

        // dry-run은 시뮬레이션이므로 초안 상태를 바꾸지 않음
        if (dryRun) {
            ledgerWriter.markOk(key, draftId, null, null);
            log.info("dry-run 게시 완료: idempotencyKey={}, draftId={}", key, draftId);
            return PublishResult.dryRun(key);
        }

        if (draftId != null && !draftService.transition(draftId, Draft.DraftStatus.PREPARED)) {
            log.warn("게시 대상 초안이 삭제됨, 스냅샷으로 계속 진행: draftId={}", draftId);
        }

        MarketplacePublishResult result;
        try {
            result = marketplaceClient.publish(listing);
        } catch (RuntimeException e) {
            log.error("마켓플레이스 게시 호출 실패: idempotencyKey={}, draftId={}", key, draftId, e);
            ledgerWriter.markFailed(key, draftId, e.getMessage(), false);
            transitionIfPresent(draftId, Draft.DraftStatus.ERROR);
            if (e instanceof ExternalServiceException external) {
                throw external;
            }
            throw new ExternalServiceException("마켓플레이스 게시 중 오류: " + e.getMessage(), e);
        }

        switch (result.getOutcome()) {
            case PUBLISHED:
                ledgerWriter.markOk(key, draftId, result.getListingId(), result.getListingUrl());
                transitionIfPresent(draftId, Draft.DraftStatus.PUBLISHED);
                return PublishResult.published(key, result.getListingId(), result.getListingUrl());
            case NEEDS_MANUAL:
                // 수동 처리 필요 여부는 원장에 남기고, 초안은 다시 편집/재게시할 수 있도록 READY로 되돌림
                ledgerWriter.markFailed(key, draftId, result.getErrorMessage(), true);
                transitionIfPresent(draftId, Draft.DraftStatus.READY);
                return PublishResult.needsManual(key, result.getErrorMessage());
            case FAILED:
            default:
                ledgerWriter.markFailed(key, draftId, result.getErrorMessage(), false);
                transitionIfPresent(draftId, Draft.DraftStatus.ERROR);
                return PublishResult.failed(key, result.getErrorMessage());
        }
    }

    public Optional<PublishLedgerEntry> findLedgerEntry(String idempotencyKey) {
        return ledgerRepository.findByIdempotencyKey(idempotencyKey);
    }

    private ListingSnapshot snapshotOf(String ownerId, PrepareRequest request) {
        ListingSnapshot base = request.getDraftId() != null
                ? ListingSnapshot.from(draftService.get(ownerId, request.getDraftId()))
                : ListingSnapshot.builder().build();

        ListingSnapshot.ListingSnapshotBuilder builder = base.toBuilder();
        if (request.getTitle() != null) {
            builder.title(request.getTitle());
        }
        if (request.getDescription() != null) {
            builder.description(request.getDescription());
        }
        if (request.getPrice() != null) {
            builder.price(request.getPrice());
        }
        if (request.getCategory() != null) {
            builder.category(request.getCategory());
        }
        if (request.getCondition() != null) {
            builder.condition(request.getCondition());
        }
        if (request.getColor() != null) {
            builder.color(request.getColor());
        }
        if (request.getBrand() != null) {
            builder.brand(request.getBrand());
        }
        if (request.getSize() != null) {
            builder.size(request.getSize());
        }
        if (request.getPhotos() != null) {
            builder.photos(new ArrayList<>(request.getPhotos()));
        }
        if (request.getHashtags() != null) {
            builder.hashtags(new ArrayList<>(request.getHashtags()));
        }
        if (request.getPriceSuggestion() != null) {
            builder.priceSuggestion(request.getPriceSuggestion());
        }
        if (request.getPublishReady() != null) {
            builder.publishReady(request.getPublishReady());
        }
        return builder.build();
    }

    private void transitionIfPresent(String draftId, Draft.DraftStatus status) {
        if (draftId != null && !draftService.transition(draftId, status)) {
            log.warn("초안 상태를 변경할 수 없음 (삭제됨): draftId={}, status={}", draftId, status);
        }
    }
}
