package com.my.mailr.domain.service.step;

import com.my.mailr.domain.exception.CollaboratorFailureException;
import com.my.mailr.domain.model.CalendarEntry;
import com.my.mailr.domain.model.CreatedEvent;
import com.my.mailr.domain.model.ExecutionContext;
import com.my.mailr.domain.model.MailMessage;
import com.my.mailr.domain.model.StepType;
import com.my.mailr.domain.port.out.CalendarPort;

import java.time.LocalDateTime;

/**
 * 왜: 앞 단계에서 찾은 일시로 캘린더 협력자에 일정을 등록하고 그 결과를 기록하기 위함.
 */
public class EventCreator implements WorkerStep {

    private final CalendarPort calendarPort;

    public EventCreator(CalendarPort calendarPort) {
        this.calendarPort = calendarPort;
    }

    @Override
    public StepType type() {
        return StepType.CREATE_EVENT;
    }

    @Override
    public CreatedEvent execute(MailMessage message, ExecutionContext context) {
        String summary = "Meeting with " + message.sender();
        LocalDateTime datetime = context.datetime().orElse(null);
        CalendarEntry entry;
        try {
            entry = calendarPort.createEvent(summary, datetime);
        } catch (CollaboratorFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException(CollaboratorFailureException.CALENDAR, "캘린더 이벤트 생성 실패", e);
        }
        if (entry == null) {
            throw new CollaboratorFailureException(CollaboratorFailureException.CALENDAR, "캘린더 응답이 null입니다.");
        }
        CreatedEvent event = new CreatedEvent(entry.eventId(), entry.status(), summary, datetime);
        context.recordCreatedEvent(event);
        return event;
    }
}
