package com.example.autolist.service;

import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.domain.Draft;
import com.example.autolist.dto.ItemDescriptor;
import com.example.autolist.dto.ListingSnapshot;
import com.example.autolist.publish.QualityGate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 분류 결과 → 초안 후보 변환
 * <p>
 * 빈 필드는 기본값으로 채우고, 해시태그와 가격 제안을 생성한 뒤 게시 준비 여부를 계산합니다.
 */
@Component
@RequiredArgsConstructor
public class DraftContentBuilder {

    private final QualityGate qualityGate;

    public Draft build(ItemDescriptor item, String ownerId, String jobId) {
        if (item.getPhotos() == null || item.getPhotos().isEmpty()) {
            throw new IllegalArgumentException("사진이 없는 상품은 초안으로 만들 수 없습니다.");
        }

        BigDecimal price = item.getPrice() != null && item.getPrice().signum() > 0
                ? item.getPrice().setScale(2, RoundingMode.HALF_UP)
                : PipelineConstants.DEFAULT_PRICE;

        Draft draft = Draft.builder()
                .ownerId(ownerId)
                .title(truncate(orDefault(item.getTitle(), PipelineConstants.DEFAULT_TITLE), PipelineConstants.TITLE_MAX_LENGTH))
                .description(orDefault(item.getDescription(), PipelineConstants.DEFAULT_DESCRIPTION))
                .price(price)
                .category(orDefault(item.getCategory(), PipelineConstants.DEFAULT_CATEGORY))
                .condition(orDefault(item.getCondition(), PipelineConstants.DEFAULT_CONDITION))
                .color(orDefault(item.getColor(), PipelineConstants.UNSPECIFIED))
                .brand(orDefault(item.getBrand(), PipelineConstants.UNSPECIFIED))
                .size(orDefault(item.getSize(), PipelineConstants.UNSPECIFIED))
                .photos(new ArrayList<>(item.getPhotos()))
                .confidence(item.isFallback() ? PipelineConstants.FALLBACK_CONFIDENCE : item.getConfidence())
                .fallback(item.isFallback())
                .sourceJobId(jobId)
                .build();

        draft.setHashtags(hashtagsFor(item, draft));
        applyPriceSuggestion(draft, price);
        applyReadiness(draft);
        return draft;
    }

    /**
     * 가격 기준 제안 범위 (80% / 100% / 120%)
     */
    public void applyPriceSuggestion(Draft draft, BigDecimal price) {
        draft.setSuggestedMinPrice(price.multiply(PipelineConstants.SUGGESTED_MIN_RATIO).setScale(2, RoundingMode.HALF_UP));
        draft.setSuggestedTargetPrice(price.setScale(2, RoundingMode.HALF_UP));
        draft.setSuggestedMaxPrice(price.multiply(PipelineConstants.SUGGESTED_MAX_RATIO).setScale(2, RoundingMode.HALF_UP));
    }

    /**
     * 게시 준비 플래그와 상태 재계산
     * 분류 실패로 채워진 초안은 사용자가 수정하기 전까지 검토 대기 상태로 둡니다.
     */
    public void applyReadiness(Draft draft) {
        boolean contentValidated = qualityGate.contentIssues(ListingSnapshot.from(draft)).isEmpty();
        boolean photosValidated = !draft.getPhotos().isEmpty();
        boolean ready = contentValidated && photosValidated && !draft.isFallback();

        draft.setContentValidated(contentValidated);
        draft.setPhotosValidated(photosValidated);
        draft.setPublishReady(ready);
        draft.setStatus(ready ? Draft.DraftStatus.READY : Draft.DraftStatus.PENDING);
    }

    List<String> hashtagsFor(ItemDescriptor item, Draft draft) {
        List<String> provided = item.getHashtags();
        if (provided != null
                && provided.size() >= PipelineConstants.HASHTAG_MIN_COUNT
                && provided.size() <= PipelineConstants.HASHTAG_MAX_COUNT) {
            return new ArrayList<>(provided);
        }

        Set<String> tags = new LinkedHashSet<>();
        for (String value : new String[]{draft.getBrand(), draft.getCategory(), draft.getColor(), draft.getSize()}) {
            String tag = toHashtag(value);
            if (tag != null) {
                tags.add(tag);
            }
        }
        for (String popular : PipelineConstants.POPULAR_HASHTAGS) {
            if (tags.size() >= PipelineConstants.HASHTAG_MAX_COUNT) {
                break;
            }
            tags.add(popular);
        }
        List<String> ordered = new ArrayList<>(tags);
        return new ArrayList<>(ordered.subList(0, Math.min(ordered.size(), PipelineConstants.HASHTAG_MAX_COUNT)));
    }

    private static String toHashtag(String value) {
        if (value == null || value.isBlank() || PipelineConstants.UNSPECIFIED.equals(value)) {
            return null;
        }
        String compact = value.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        return compact.isEmpty() ? null : "#" + compact;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
