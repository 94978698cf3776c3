package com.my.mailr.domain.service.step;

import com.my.mailr.domain.model.DateTimeExtraction;
import com.my.mailr.domain.model.ExecutionContext;
import com.my.mailr.domain.model.MailMessage;
import com.my.mailr.domain.model.StepType;
import com.my.mailr.domain.port.out.ClockPort;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;

/**
 * 왜: 본문의 시간 단서("tomorrow", "today", "4 pm")를 기준 시각에 맞춰 구체적인 일시로 바꾸기 위함.
 * 단서가 없어도 실패가 아니라 빈 결과다.
 */
public class DateTimeExtractor implements WorkerStep {

    static final LocalTime MEETING_TIME = LocalTime.of(16, 0);

    private final ClockPort clockPort;

    public DateTimeExtractor(ClockPort clockPort) {
        this.clockPort = clockPort;
    }

    @Override
    public StepType type() {
        return StepType.EXTRACT_DATETIME;
    }

    @Override
    public DateTimeExtraction execute(MailMessage message, ExecutionContext context) {
        DateTimeExtraction extraction = extract(message.body());
        context.recordDatetime(extraction.datetime());
        return extraction;
    }

    public DateTimeExtraction extract(String body) {
        String text = body == null ? "" : body.toLowerCase(Locale.ROOT);
        LocalDate today = clockPort.now().toLocalDate();
        if (text.contains("tomorrow")) {
            return at(today.plusDays(1));
        }
        if (text.contains("today")) {
            return at(today);
        }
        if (text.contains("4 pm") || text.contains("4pm")) {
            return at(today.plusDays(1));
        }
        return DateTimeExtraction.none();
    }

    private DateTimeExtraction at(LocalDate date) {
        return new DateTimeExtraction(date.atTime(MEETING_TIME));
    }
}
