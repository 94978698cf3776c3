package com.my.mailr.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 의도에서 파생된 단계 순서를 불변 구조로 고정하고, 선행 단계 없이 일정 생성이 실행되는 계획을 거부하기 위함.
 */
public record Plan(Intent intent, List<StepType> steps) {
    public Plan {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(steps, "steps");
        steps = List.copyOf(steps);
        int extractAt = steps.indexOf(StepType.EXTRACT_DATETIME);
        int createAt = steps.indexOf(StepType.CREATE_EVENT);
        if (createAt >= 0 && (extractAt < 0 || extractAt > createAt)) {
            throw new IllegalArgumentException("create_event는 extract_datetime 이후에만 올 수 있습니다: " + steps);
        }
    }
}
