package com.example.autolist.publish;

import com.example.autolist.domain.PublishLedgerEntry;
import com.example.autolist.domain.PublishLedgerEntry.LedgerStatus;
import com.example.autolist.repository.PublishLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 게시 원장 기록
 * <p>
 * 각 쓰기는 독립 트랜잭션으로 즉시 커밋되어, 외부 호출 전후의 상태가 다른 요청에 바로 보입니다.
 * 예약 이후의 갱신은 RESERVED 상태의 행에 대해 단 한 번만 허용됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PublishLedgerWriter {

    private final PublishLedgerRepository ledgerRepository;
    private final Clock clock;

    /**
     * 멱등성 키 예약 (원자적 INSERT)
     *
     * @throws org.springframework.dao.DataIntegrityViolationException 이미 같은 키가 있는 경우
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PublishLedgerEntry reserve(String idempotencyKey, String confirmToken, boolean dryRun) {
        PublishLedgerEntry entry = PublishLedgerEntry.builder()
                .idempotencyKey(idempotencyKey)
                .confirmToken(confirmToken)
                .dryRun(dryRun)
                .status(LedgerStatus.RESERVED)
                .createdAt(LocalDateTime.now(clock))
                .build();
        PublishLedgerEntry saved = ledgerRepository.saveAndFlush(entry);
        log.info("게시 키 예약: idempotencyKey={}, dryRun={}", idempotencyKey, dryRun);
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markOk(String idempotencyKey, String draftId, String listingId, String listingUrl) {
        PublishLedgerEntry entry = reserved(idempotencyKey);
        entry.setStatus(LedgerStatus.OK);
        entry.setDraftId(draftId);
        entry.setListingId(listingId);
        entry.setListingUrl(listingUrl);
        entry.setCompletedAt(LocalDateTime.now(clock));
        ledgerRepository.save(entry);
        log.info("게시 원장 완료: idempotencyKey={}, listingId={}", idempotencyKey, listingId);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(String idempotencyKey, String draftId, String errorMessage, boolean needsManual) {
        PublishLedgerEntry entry = reserved(idempotencyKey);
        entry.setStatus(LedgerStatus.FAILED);
        entry.setDraftId(draftId);
        entry.setNeedsManual(needsManual);
        entry.setErrorMessage(truncate(errorMessage));
        entry.setCompletedAt(LocalDateTime.now(clock));
        ledgerRepository.save(entry);
        log.warn("게시 원장 실패 기록: idempotencyKey={}, needsManual={}, error={}", idempotencyKey, needsManual, errorMessage);
    }

    private PublishLedgerEntry reserved(String idempotencyKey) {
        PublishLedgerEntry entry = ledgerRepository.findByIdempotencyKey(idempotencyKey)
                .orElseThrow(() -> new IllegalStateException("예약되지 않은 게시 키입니다: " + idempotencyKey));
        if (entry.getStatus() != LedgerStatus.RESERVED) {
            throw new IllegalStateException("이미 결과가 기록된 게시 키입니다: " + idempotencyKey + " (" + entry.getStatus() + ")");
        }
        return entry;
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 2000 ? message : message.substring(0, 2000);
    }
}
