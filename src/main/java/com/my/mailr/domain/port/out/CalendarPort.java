package com.my.mailr.domain.port.out;

import com.my.mailr.domain.model.CalendarEntry;

import java.time.LocalDateTime;

/**
 * 왜: 캘린더 연동을 추상화하여 실제 연동이 붙어도 오케스트레이터가 바뀌지 않도록 하기 위함.
 */
public interface CalendarPort {
    /**
     * 일정을 등록한다. datetime은 본문에서 시각을 찾지 못한 경우 null이다.
     */
    CalendarEntry createEvent(String summary, LocalDateTime datetime);
}
