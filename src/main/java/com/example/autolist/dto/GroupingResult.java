package com.example.autolist.dto;

import lombok.Getter;

import java.util.List;

/**
 * 사진 그룹핑 결과
 * errors에는 분류에 끝내 실패해 기본값으로 채운 사진 그룹이 기록됩니다.
 */
@Getter
public class GroupingResult {

    private final List<ItemDescriptor> descriptors;
    private final List<String> errors;

    public GroupingResult(List<ItemDescriptor> descriptors, List<String> errors) {
        this.descriptors = List.copyOf(descriptors);
        this.errors = List.copyOf(errors);
    }
}
