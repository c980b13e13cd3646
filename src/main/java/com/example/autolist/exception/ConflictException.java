package com.example.autolist.exception;

import lombok.Getter;

/**
 * 이미 사용된 Idempotency-Key로 게시를 시도한 경우
 */
@Getter
public class ConflictException extends RuntimeException {

    private final String idempotencyKey;

    public ConflictException(String idempotencyKey) {
        super("이미 처리된 게시 요청입니다. 재시도하려면 새 Idempotency-Key를 사용하세요: " + idempotencyKey);
        this.idempotencyKey = idempotencyKey;
    }
}
