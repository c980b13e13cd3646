package com.example.autolist.exception;

/**
 * 확인 토큰의 유효 시간이 지난 경우
 */
public class ExpiredTokenException extends RuntimeException {

    public ExpiredTokenException(String message) {
        super(message);
    }
}
