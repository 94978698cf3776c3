package com.my.mailr.domain.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 왜: 캘린더 협력자가 돌려준 식별자와 요청한 일정 정보를 한 레코드로 남기기 위함.
 */
public record CreatedEvent(
        String eventId,
        String status,
        String summary,
        LocalDateTime datetime
) implements StepOutput {
    public CreatedEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(summary, "summary");
        if (summary.isBlank()) {
            throw new IllegalArgumentException("이벤트 제목은 비어 있을 수 없습니다.");
        }
    }
}
