package com.example.autolist.dto;

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
 * 분류기가 돌려주는 상품 단위 분석 결과
 * photos에는 이 상품에 속한 원본 사진 경로가 업로드 순서대로 들어갑니다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ItemDescriptor {

    private String title;
    private String description;
    private BigDecimal price;
    private String category;
    private String condition;
    private String color;
    private String brand;
    private String size;
    private double confidence;

    @Builder.Default
    private List<String> photos = new ArrayList<>();

    // 분류기가 해시태그를 제공하지 않으면 초안 생성 시 자동 생성
    @Builder.Default
    private List<String> hashtags = new ArrayList<>();

    private boolean fallback; // 분류 실패로 만든 자리표시 결과
}
