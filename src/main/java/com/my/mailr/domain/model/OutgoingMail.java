package com.my.mailr.domain.model;

import java.util.Objects;

/**
 * 왜: 최종 응답 메일의 계약을 고정하여 전송 어댑터가 일관된 형태로 받도록 하기 위함.
 */
public record OutgoingMail(long inReplyTo, String recipient, String content) {
    public OutgoingMail {
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(content, "content");
        if (recipient.isBlank()) {
            throw new IllegalArgumentException("recipient는 비어 있을 수 없습니다.");
        }
    }
}
