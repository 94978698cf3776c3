package com.my.mailr.domain.exception;

/**
 * 왜: 외부 입력이 계약을 위반했을 때 파이프라인 진입 전에 명확히 실패를 알리기 위함.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
