package com.my.mailr.domain.service;

import com.my.mailr.domain.model.Intent;
import com.my.mailr.domain.model.Plan;
import com.my.mailr.domain.model.StepType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 왜: 의도별 단계 순서를 고정 조회표로 두어 같은 의도에는 항상 같은 계획이 나오도록 하기 위함.
 */
public class Planner {

    private static final Map<Intent, List<StepType>> TABLE = new EnumMap<>(Intent.class);

    static {
        TABLE.put(Intent.MEETING_REQUEST, List.of(StepType.EXTRACT_DATETIME, StepType.CREATE_EVENT, StepType.DRAFT_REPLY));
        TABLE.put(Intent.INFO_REQUEST, List.of(StepType.FIND_ANSWER, StepType.DRAFT_REPLY));
        TABLE.put(Intent.ACKNOWLEDGEMENT, List.of(StepType.DRAFT_ACK));
        TABLE.put(Intent.GENERAL, List.of(StepType.DRAFT_GENERAL_REPLY));
    }

    public Plan plan(Intent intent) {
        List<StepType> steps = TABLE.get(intent);
        if (steps == null) {
            throw new IllegalStateException("계획표에 없는 의도입니다: " + intent);
        }
        return new Plan(intent, steps);
    }
}
