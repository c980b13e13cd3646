package com.example.autolist.util;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Locale;

/**
 * 제목 유사도 계산 (0~100)
 * <p>
 * 정규화된 Indel 비율: 200 * LCS(a, b) / (len(a) + len(b)).
 * 비교 전 양쪽 모두 소문자로 변환하고 앞뒤 공백을 제거합니다.
 */
public class TitleSimilarity {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    public static double ratio(String first, String second) {
        String a = normalize(first);
        String b = normalize(second);
        int total = a.length() + b.length();
        if (total == 0) {
            // 빈 문자열끼리는 동일한 것으로 취급
            return 100.0;
        }
        int common = LCS.apply(a, b);
        return 200.0 * common / total;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private TitleSimilarity() {
        // 유틸 클래스이므로 인스턴스 생성 방지
    }
}
