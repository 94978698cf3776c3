package com.my.mailr.domain.model;

import java.util.Objects;

/**
 * 왜: 처리 결과를 원본 메일과 묶어 발행/요약 단계에서 발신자와 식별자를 함께 참조하기 위함.
 */
public record ProcessedMail(MailMessage message, ActionResult result) {
    public ProcessedMail {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(result, "result");
    }
}
