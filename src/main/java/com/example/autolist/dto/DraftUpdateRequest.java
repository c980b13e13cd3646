package com.example.autolist.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;

/**
 * 초안 수정 요청 (null 필드는 변경하지 않음)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class DraftUpdateRequest {

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
}
