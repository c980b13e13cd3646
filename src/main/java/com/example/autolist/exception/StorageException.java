package com.example.autolist.exception;

/**
 * 저장소 쓰기 실패. 호출 측에서 재시도할 수 있습니다.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
