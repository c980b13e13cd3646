package com.example.autolist.publish;

import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.dto.ListingSnapshot;
import com.example.autolist.dto.PriceSuggestion;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 게시 전 품질 점검
 * <p>
 * 실패 사유는 사용자에게 그대로 노출되므로 필드 이름을 포함한 문장으로 작성합니다.
 */
@Component
public class QualityGate {

    /**
     * 게시 가능 여부 전체 점검 (내용 + publishReady 플래그)
     *
     * @return 실패 사유 목록 (비어 있으면 통과)
     */
    public List<String> evaluate(ListingSnapshot listing) {
        List<String> reasons = contentIssues(listing);
        if (!listing.isPublishReady()) {
            reasons.add("publishReady가 설정되지 않았습니다. 초안을 검토한 뒤 게시 준비 상태로 표시하세요.");
        }
        return reasons;
    }

    /**
     * 리스팅 내용 점검 (제목, 해시태그, 가격, 가격 제안)
     */
    public List<String> contentIssues(ListingSnapshot listing) {
        List<String> reasons = new ArrayList<>();

        String title = listing.getTitle();
        if (title == null || title.isBlank()) {
            reasons.add("title이 비어 있습니다.");
        } else if (title.length() > PipelineConstants.TITLE_MAX_LENGTH) {
            reasons.add("title은 " + PipelineConstants.TITLE_MAX_LENGTH + "자 이하여야 합니다 (현재 " + title.length() + "자)");
        }

        int hashtagCount = listing.getHashtags() == null ? 0 : listing.getHashtags().size();
        if (hashtagCount < PipelineConstants.HASHTAG_MIN_COUNT || hashtagCount > PipelineConstants.HASHTAG_MAX_COUNT) {
            reasons.add("hashtag 개수는 " + PipelineConstants.HASHTAG_MIN_COUNT + "~" + PipelineConstants.HASHTAG_MAX_COUNT
                    + "개여야 합니다 (현재 " + hashtagCount + "개)");
        }

        BigDecimal price = listing.getPrice();
        if (price == null || price.signum() <= 0) {
            reasons.add("price는 0보다 커야 합니다.");
        }

        PriceSuggestion suggestion = listing.getPriceSuggestion();
        if (suggestion == null || !suggestion.isComplete()) {
            reasons.add("priceSuggestion(min/target/max)이 필요합니다.");
        } else if (suggestion.getMin().compareTo(suggestion.getTarget()) > 0
                || suggestion.getTarget().compareTo(suggestion.getMax()) > 0) {
            reasons.add("priceSuggestion은 min <= target <= max 순서여야 합니다.");
        }

        return reasons;
    }
}
