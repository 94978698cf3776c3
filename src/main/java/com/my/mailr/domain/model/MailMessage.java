package com.my.mailr.domain.model;

import com.my.mailr.domain.exception.InvalidRequestException;

import java.time.OffsetDateTime;

/**
 * 왜: 외부에서 들어온 메일의 최소 계약을 강제하여 파이프라인 진입 전에 결함을 드러내기 위함.
 */
public record MailMessage(
        long id,
        String sender,
        String subject,
        String body,
        OffsetDateTime receivedAt
) {
    public MailMessage {
        requirePresent(sender, "sender");
        requirePresent(subject, "subject");
        requirePresent(body, "body");
        requirePresent(receivedAt, "receivedAt");
        if (sender.indexOf('@') < 0) {
            throw new InvalidRequestException("발신자 주소 형식이 올바르지 않습니다: " + sender);
        }
    }

    /**
     * 발신자 주소의 로컬 파트('@' 앞부분).
     */
    public String senderLocalPart() {
        return sender.substring(0, sender.indexOf('@'));
    }

    private static void requirePresent(Object value, String field) {
        if (value == null) {
            throw new InvalidRequestException("메일 필수 필드가 없습니다: " + field);
        }
    }
}
