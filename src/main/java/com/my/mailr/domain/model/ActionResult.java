package com.my.mailr.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 실행한 단계의 산출물, 최종 응답, 완료 여부를 한 번에 호출자에게 넘기는 불변 기록을 제공하기 위함.
 */
public record ActionResult(
        Plan plan,
        Map<StepType, StepOutput> stepOutputs,
        String reply,
        boolean sent
) {
    public ActionResult {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(stepOutputs, "stepOutputs");
        Objects.requireNonNull(reply, "reply");
        // 실행 순서를 보존한다.
        stepOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(stepOutputs));
    }

    public Intent intent() {
        return plan.intent();
    }

    public Optional<DateTimeExtraction> extraction() {
        return Optional.ofNullable((DateTimeExtraction) stepOutputs.get(StepType.EXTRACT_DATETIME));
    }

    public Optional<CreatedEvent> createdEvent() {
        return Optional.ofNullable((CreatedEvent) stepOutputs.get(StepType.CREATE_EVENT));
    }
}
