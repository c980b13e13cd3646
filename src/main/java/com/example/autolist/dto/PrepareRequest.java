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
 * 게시 준비(Phase A) 요청
 * draftId가 있으면 저장된 초안을 기준으로 하고, 요청에 들어온 값이 초안 값을 덮어씁니다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrepareRequest {

    private String draftId;
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
    private Boolean publishReady;
    private boolean dryRun;
}
