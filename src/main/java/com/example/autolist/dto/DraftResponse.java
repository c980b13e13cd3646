package com.example.autolist.dto;

import com.example.autolist.domain.Draft;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 초안 조회 응답
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftResponse {

    private String id;
    private String ownerId;
    private String title;
    private String description;
    private BigDecimal price;
    private String category;
    private String condition;
    private String color;
    private String brand;
    private String size;
    private List<String> photos;
    private List<String> hashtags;
    private PriceSuggestion priceSuggestion;
    private String status;
    private double confidence;
    private boolean fallback;
    private boolean publishReady;
    private boolean contentValidated;
    private boolean photosValidated;
    private String sourceJobId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static DraftResponse from(Draft draft) {
        PriceSuggestion suggestion = null;
        if (draft.getSuggestedTargetPrice() != null) {
            suggestion = PriceSuggestion.builder()
                    .min(draft.getSuggestedMinPrice())
                    .target(draft.getSuggestedTargetPrice())
                    .max(draft.getSuggestedMaxPrice())
                    .build();
        }
        return DraftResponse.builder()
                .id(draft.getId())
                .ownerId(draft.getOwnerId())
                .title(draft.getTitle())
                .description(draft.getDescription())
                .price(draft.getPrice())
                .category(draft.getCategory())
                .condition(draft.getCondition())
                .color(draft.getColor())
                .brand(draft.getBrand())
                .size(draft.getSize())
                .photos(List.copyOf(draft.getPhotos()))
                .hashtags(List.copyOf(draft.getHashtags()))
                .priceSuggestion(suggestion)
                .status(draft.getStatus().name().toLowerCase())
                .confidence(draft.getConfidence())
                .fallback(draft.isFallback())
                .publishReady(draft.isPublishReady())
                .contentValidated(draft.isContentValidated())
                .photosValidated(draft.isPhotosValidated())
                .sourceJobId(draft.getSourceJobId())
                .createdAt(draft.getCreatedAt())
                .updatedAt(draft.getUpdatedAt())
                .build();
    }
}
