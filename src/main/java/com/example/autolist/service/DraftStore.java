package com.example.autolist.service;

import com.example.autolist.dedup.Deduplicator;
import com.example.autolist.domain.Draft;
import com.example.autolist.dto.ResolvedDraft;
import com.example.autolist.exception.StorageException;
import com.example.autolist.repository.DraftRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 중복 병합 초안 저장소
 * <p>
 * 같은 소유자/브랜드/카테고리에 제목이 충분히 비슷한 초안이 있으면 새로 만들지 않고
 * 기존 초안에 사진을 합칩니다. 조회와 쓰기는 (소유자, 브랜드, 카테고리) 단위 잠금 안에서
 * 하나의 트랜잭션으로 실행되며, 잠금은 커밋 이후에 해제됩니다.
 */
@Slf4j
@Service
public class DraftStore {

    private static final EnumSet<Draft.DraftStatus> MERGEABLE_STATUSES =
            EnumSet.of(Draft.DraftStatus.PENDING, Draft.DraftStatus.READY);

    private final DraftRepository draftRepository;
    private final Deduplicator deduplicator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // TODO: 오래 사용되지 않은 키의 잠금 객체 정리 (소유자 수가 많아지면 맵이 계속 커짐)
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public DraftStore(DraftRepository draftRepository,
                      Deduplicator deduplicator,
                      PlatformTransactionManager transactionManager,
                      Clock clock) {
        this.draftRepository = draftRepository;
        this.deduplicator = deduplicator;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * 초안 저장 (중복이면 병합)
     * 호출 측은 반드시 반환된 초안의 ID를 사용해야 합니다.
     *
     * @throws StorageException DB 오류 (재시도 가능)
     */
    public ResolvedDraft saveDraft(Draft candidate) {
        ReentrantLock lock = locks.computeIfAbsent(lockKey(candidate), key -> new ReentrantLock());
        lock.lock();
        try {
            return transactionTemplate.execute(status -> resolve(candidate));
        } catch (DataAccessException | TransactionException e) {
            log.error("초안 저장 실패: ownerId={}, title={}", candidate.getOwnerId(), candidate.getTitle(), e);
            throw new StorageException("초안 저장 실패: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private ResolvedDraft resolve(Draft candidate) {
        List<Draft> candidates = draftRepository.findByOwnerIdAndBrandIgnoreCaseAndCategoryIgnoreCaseAndStatusIn(
                candidate.getOwnerId(), candidate.getBrand(), candidate.getCategory(), MERGEABLE_STATUSES);

        Optional<Draft> duplicate = findDuplicate(candidate, candidates);
        if (duplicate.isEmpty()) {
            LocalDateTime now = LocalDateTime.now(clock);
            candidate.setCreatedAt(now);
            candidate.setUpdatedAt(now);
            Draft saved = draftRepository.saveAndFlush(candidate);
            log.debug("신규 초안 생성: id={}, title={}", saved.getId(), saved.getTitle());
            return new ResolvedDraft(saved, false);
        }

        Draft existing = duplicate.get();
        List<String> merged = mergePhotos(existing.getPhotos(), candidate.getPhotos());
        existing.getPhotos().clear();
        existing.getPhotos().addAll(merged);
        existing.setPhotosValidated(!merged.isEmpty());
        existing.setUpdatedAt(LocalDateTime.now(clock));
        Draft saved = draftRepository.saveAndFlush(existing);

        log.info("중복 초안 병합: id={}, title={}, photos={}", saved.getId(), saved.getTitle(), merged.size());
        return new ResolvedDraft(saved, true);
    }

    private Optional<Draft> findDuplicate(Draft candidate, List<Draft> candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<String> titles = new ArrayList<>();
        for (Draft draft : candidates) {
            titles.add(draft.getTitle());
        }
        try {
            return deduplicator.findDuplicate(candidate.getTitle(), titles).map(candidates::get);
        } catch (RuntimeException e) {
            log.warn("중복 판정 실패, 신규 초안으로 저장: title={}", candidate.getTitle(), e);
            return Optional.empty();
        }
    }

    private List<String> mergePhotos(List<String> existing, List<String> incoming) {
        try {
            return deduplicator.mergePhotos(existing, incoming);
        } catch (RuntimeException e) {
            log.warn("사진 해시 비교 실패, 경로 기준으로만 병합합니다.", e);
            LinkedHashSet<String> union = new LinkedHashSet<>(existing);
            union.addAll(incoming);
            return new ArrayList<>(union);
        }
    }

    private static String lockKey(Draft draft) {
        return draft.getOwnerId() + "|" + normalize(draft.getBrand()) + "|" + normalize(draft.getCategory());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
