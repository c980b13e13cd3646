package com.example.autolist.exception;

import lombok.Getter;

/**
 * 업로드 사전 점검에서 용량/개수 한도를 넘은 경우
 */
@Getter
public class QuotaExceededException extends RuntimeException {

    private final String quotaType;
    private final long limit;

    public QuotaExceededException(String quotaType, long limit) {
        super(quotaType + " 한도(" + limit + ")를 초과했습니다.");
        this.quotaType = quotaType;
        this.limit = limit;
    }
}
