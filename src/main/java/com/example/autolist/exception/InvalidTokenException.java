package com.example.autolist.exception;

/**
 * 확인 토큰 서명이 올바르지 않거나 형식이 깨진 경우
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
