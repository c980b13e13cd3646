package com.example.autolist.client;

import com.example.autolist.dto.ItemDescriptor;

import java.util.List;

/**
 * 사진 → 상품 분류기
 */
public interface ItemClassifier {

    /**
     * 사진 묶음을 상품 단위로 그룹핑하고 각 상품의 정보를 추출합니다.
     * 반환된 각 항목의 photos는 입력 경로의 부분집합입니다.
     *
     * @param photoPaths 업로드 순서대로 정렬된 사진 경로
     * @param style      설명 문체 힌트
     * @throws com.example.autolist.exception.ExternalServiceException 호출 또는 응답 해석 실패 시
     */
    List<ItemDescriptor> classify(List<String> photoPaths, String style);
}
