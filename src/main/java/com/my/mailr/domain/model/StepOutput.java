package com.my.mailr.domain.model;

/**
 * 왜: 실행 단계별 산출물을 하나의 타입으로 묶어 결과 매핑에 기록하기 위함.
 */
public interface StepOutput {
}
