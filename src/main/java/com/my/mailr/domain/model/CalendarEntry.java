package com.my.mailr.domain.model;

import java.util.Objects;

/**
 * 왜: 캘린더 협력자의 응답 계약(식별자, 상태)을 고정하기 위함.
 */
public record CalendarEntry(String eventId, String status) {
    public CalendarEntry {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(status, "status");
    }
}
