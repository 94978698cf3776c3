package com.my.mailr.domain.model;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 왜: 한 메일을 처리하는 동안 단계 산출물을 다음 단계와 응답 생성기로 넘기는 공유 상태를 명시적 필드로 제한하기 위함.
 * 메일마다 새로 만들며 스레드 간에 공유하지 않는다.
 */
public class ExecutionContext {

    private LocalDateTime datetime;
    private CreatedEvent createdEvent;

    public Optional<LocalDateTime> datetime() {
        return Optional.ofNullable(datetime);
    }

    public void recordDatetime(LocalDateTime datetime) {
        this.datetime = datetime;
    }

    public Optional<CreatedEvent> createdEvent() {
        return Optional.ofNullable(createdEvent);
    }

    public void recordCreatedEvent(CreatedEvent createdEvent) {
        this.createdEvent = createdEvent;
    }
}
