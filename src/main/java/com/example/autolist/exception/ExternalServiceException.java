package com.example.autolist.exception;

/**
 * 분류기 또는 마켓플레이스 호출 실패 (네트워크, 서버 오류, 응답 파싱 실패)
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
