package com.example.autolist.dedup;

import java.util.List;
import java.util.Optional;

/**
 * 초안 중복 판정 전략
 * <p>
 * 제목 유사도로 같은 상품인지 판정하고, 같은 상품이면 사진 목록을 합칩니다.
 */
public interface Deduplicator {

    /**
     * 제목 유사도 (0~100)
     */
    double titleSimilarity(String first, String second);

    /**
     * 후보 중 제목 유사도가 임계값 이상이면서 가장 높은 후보의 인덱스
     *
     * @return 일치하는 후보가 없으면 empty
     */
    Optional<Integer> findDuplicate(String title, List<String> candidateTitles);

    /**
     * 기존 사진 목록과 신규 사진 목록의 합집합 (기존 순서 우선, 같은 사진 제거)
     */
    List<String> mergePhotos(List<String> existing, List<String> incoming);
}
