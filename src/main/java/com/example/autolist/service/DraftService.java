package com.example.autolist.service;

import com.example.autolist.domain.Draft;
import com.example.autolist.dto.DraftListResponse;
import com.example.autolist.dto.DraftResponse;
import com.example.autolist.dto.DraftUpdateRequest;
import com.example.autolist.exception.ResourceNotFoundException;
import com.example.autolist.repository.DraftRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 초안 조회/수정/삭제
 * 모든 작업은 소유자 기준으로 제한됩니다. 다른 소유자의 초안은 존재하지 않는 것으로 취급합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class DraftService {

    private static final int MAX_PAGE_SIZE = 100;

    private final DraftRepository draftRepository;
    private final DraftContentBuilder contentBuilder;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DraftListResponse list(String ownerId, String status, int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page는 1 이상이어야 합니다: " + page);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize는 1~" + MAX_PAGE_SIZE + " 사이여야 합니다: " + pageSize);
        }
        PageRequest pageable = PageRequest.of(page - 1, pageSize, Sort.by(Sort.Direction.DESC, "createdAt"));

        Page<Draft> drafts;
        if (status == null || status.isBlank()) {
            drafts = draftRepository.findByOwnerId(ownerId, pageable);
        } else {
            drafts = draftRepository.findByOwnerIdAndStatus(ownerId, parseStatus(status), pageable);
        }

        return DraftListResponse.builder()
                .drafts(drafts.getContent().stream().map(DraftResponse::from).toList())
                .total(drafts.getTotalElements())
                .page(page)
                .pageSize(pageSize)
                .build();
    }

    @Transactional(readOnly = true)
    public Draft get(String ownerId, String draftId) {
        return draftRepository.findByIdAndOwnerId(draftId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("초안을 찾을 수 없습니다: " + draftId));
    }

    /**
     * 작업 결과 조회용 (소유자 제한 없음, 삭제된 초안은 건너뜀)
     */
    @Transactional(readOnly = true)
    public List<Draft> findAll(List<String> draftIds) {
        List<Draft> drafts = new ArrayList<>();
        for (String id : draftIds) {
            draftRepository.findById(id).ifPresent(drafts::add);
        }
        return drafts;
    }

    public Draft update(String ownerId, String draftId, DraftUpdateRequest request) {
        Draft draft = get(ownerId, draftId);
        if (draft.getStatus() == Draft.DraftStatus.PUBLISHED || draft.getStatus() == Draft.DraftStatus.PREPARED) {
            throw new IllegalStateException("게시 중이거나 게시된 초안은 수정할 수 없습니다: " + draftId + " (" + draft.getStatus() + ")");
        }

        if (request.getTitle() != null) {
            draft.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            draft.setDescription(request.getDescription());
        }
        if (request.getPrice() != null) {
            if (request.getPrice().signum() <= 0) {
                throw new IllegalArgumentException("price는 0보다 커야 합니다.");
            }
            draft.setPrice(request.getPrice().setScale(2, RoundingMode.HALF_UP));
        }
        if (request.getCategory() != null) {
            draft.setCategory(request.getCategory());
        }
        if (request.getCondition() != null) {
            draft.setCondition(request.getCondition());
        }
        if (request.getColor() != null) {
            draft.setColor(request.getColor());
        }
        if (request.getBrand() != null) {
            draft.setBrand(request.getBrand());
        }
        if (request.getSize() != null) {
            draft.setSize(request.getSize());
        }
        if (request.getPhotos() != null) {
            draft.getPhotos().clear();
            draft.getPhotos().addAll(request.getPhotos());
        }
        if (request.getHashtags() != null) {
            draft.getHashtags().clear();
            draft.getHashtags().addAll(request.getHashtags());
        }
        if (request.getPriceSuggestion() != null) {
            draft.setSuggestedMinPrice(request.getPriceSuggestion().getMin());
            draft.setSuggestedTargetPrice(request.getPriceSuggestion().getTarget());
            draft.setSuggestedMaxPrice(request.getPriceSuggestion().getMax());
        } else if (request.getPrice() != null) {
            contentBuilder.applyPriceSuggestion(draft, draft.getPrice());
        }

        // 사용자가 직접 검토했으므로 기본값 초안 표시를 해제
        draft.setFallback(false);
        contentBuilder.applyReadiness(draft);
        draft.setUpdatedAt(LocalDateTime.now(clock));

        Draft saved = draftRepository.save(draft);
        log.info("초안 수정: id={}, status={}, publishReady={}", saved.getId(), saved.getStatus(), saved.isPublishReady());
        return saved;
    }

    public void delete(String ownerId, String draftId) {
        Draft draft = get(ownerId, draftId);
        if (draft.getStatus() == Draft.DraftStatus.PREPARED) {
            throw new IllegalStateException("게시가 진행 중인 초안은 삭제할 수 없습니다: " + draftId);
        }
        draftRepository.delete(draft);
        log.info("초안 삭제: id={}", draftId);
    }

    /**
     * 게시 흐름에서의 상태 전이 (소유자 확인은 토큰 서명으로 대신함)
     *
     * @return 초안이 없으면 false
     */
    public boolean transition(String draftId, Draft.DraftStatus status) {
        return draftRepository.findById(draftId)
                .map(draft -> {
                    draft.setStatus(status);
                    draft.setUpdatedAt(LocalDateTime.now(clock));
                    draftRepository.save(draft);
                    log.debug("초안 상태 변경: id={}, status={}", draftId, status);
                    return true;
                })
                .orElse(false);
    }

    private static Draft.DraftStatus parseStatus(String status) {
        try {
            return Draft.DraftStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("알 수 없는 초안 상태입니다: " + status, e);
        }
    }
}
