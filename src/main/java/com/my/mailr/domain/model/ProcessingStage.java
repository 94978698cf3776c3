package com.my.mailr.domain.model;

/**
 * 왜: 메일 한 건의 처리 진행 단계를 로그로 추적하기 위함. 저장하지 않으며 되돌아가는 전이는 없다.
 */
public enum ProcessingStage {
    RECEIVED,
    CLASSIFIED,
    PLANNED,
    STEPS_EXECUTED,
    REPLY_DRAFTED,
    QA_FINALIZED,
    COMPLETED
}
