package com.my.mailr.domain.exception;

/**
 * 왜: 캘린더/메일 협력자 실패를 전송 성공으로 흡수하지 않고 별도 실패로 호출자에게 드러내기 위함.
 */
public class CollaboratorFailureException extends RuntimeException {

    public static final String CALENDAR = "calendar";
    public static final String MAIL = "mail";

    private final String collaborator;

    public CollaboratorFailureException(String collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorFailureException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public String collaborator() {
        return collaborator;
    }
}
