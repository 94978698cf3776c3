package com.my.mailr.domain.service.step;

import com.my.mailr.domain.model.ExecutionContext;
import com.my.mailr.domain.model.MailMessage;
import com.my.mailr.domain.model.StepOutput;
import com.my.mailr.domain.model.StepType;

/**
 * 왜: 실행 가능한 계획 단계를 동일한 계약으로 다뤄 오케스트레이터가 단계 종류에 따라 분기하지 않도록 하기 위함.
 */
public interface WorkerStep {

    StepType type();

    /**
     * 단계를 실행하고 산출물을 context에 기록한 뒤 반환한다.
     */
    StepOutput execute(MailMessage message, ExecutionContext context);
}
