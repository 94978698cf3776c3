package com.my.mailr.adapter.out.calendar;

import com.my.mailr.config.AppConfig;
import com.my.mailr.domain.model.CalendarEntry;
import com.my.mailr.domain.port.out.CalendarPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 왜: 실제 캘린더 연동 없이 일정 생성 계약을 만족하는 대역을 제공하기 위함.
 * 이벤트 ID는 프로세스 안에서만 유일하다.
 */
@ApplicationScoped
public class InMemoryCalendarAdapter implements CalendarPort {

    static final String STATUS_CREATED = "created";

    private static final Logger log = Logger.getLogger(InMemoryCalendarAdapter.class);

    private final String eventIdPrefix;
    private final AtomicLong sequence = new AtomicLong();

    @Inject
    public InMemoryCalendarAdapter(AppConfig appConfig) {
        this(appConfig.calendar().eventIdPrefix());
    }

    InMemoryCalendarAdapter(String eventIdPrefix) {
        this.eventIdPrefix = eventIdPrefix;
    }

    @Override
    public CalendarEntry createEvent(String summary, LocalDateTime datetime) {
        String eventId = eventIdPrefix + Instant.now().getEpochSecond() + "_" + sequence.incrementAndGet();
        log.infof("캘린더 이벤트 등록(대역): id=%s, summary=%s, datetime=%s", eventId, summary, datetime);
        return new CalendarEntry(eventId, STATUS_CREATED);
    }
}
