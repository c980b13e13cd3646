package com.example.autolist.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * 가격 제안 (최저/목표/최고)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceSuggestion {

    private BigDecimal min;
    private BigDecimal target;
    private BigDecimal max;

    @JsonIgnore
    public boolean isComplete() {
        return min != null && target != null && max != null;
    }
}
