package com.example.autolist.dto;

import com.example.autolist.domain.Draft;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 게시할 리스팅의 스냅샷
 * 확인 토큰에 그대로 서명되어 들어가므로, publish 단계는 이 값만으로 동작합니다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListingSnapshot {

    private String draftId;
    private String title;
    private String description;
    private BigDecimal price;
    private String category;
    private String condition;
    private String color;
    private String brand;
    private String size;

    @Builder.Default
    private List<String> photos = new ArrayList<>();

    @Builder.Default
    private List<String> hashtags = new ArrayList<>();

    private PriceSuggestion priceSuggestion;

    private boolean publishReady;

    public static ListingSnapshot from(Draft draft) {
        PriceSuggestion suggestion = null;
        if (draft.getSuggestedTargetPrice() != null) {
            suggestion = PriceSuggestion.builder()
                    .min(draft.getSuggestedMinPrice())
                    .target(draft.getSuggestedTargetPrice())
                    .max(draft.getSuggestedMaxPrice())
                    .build();
        }
        return ListingSnapshot.builder()
                .draftId(draft.getId())
                .title(draft.getTitle())
                .description(draft.getDescription())
                .price(draft.getPrice())
                .category(draft.getCategory())
                .condition(draft.getCondition())
                .color(draft.getColor())
                .brand(draft.getBrand())
                .size(draft.getSize())
                .photos(new ArrayList<>(draft.getPhotos()))
                .hashtags(new ArrayList<>(draft.getHashtags()))
                .priceSuggestion(suggestion)
                .publishReady(draft.isPublishReady())
                .build();
    }
}
