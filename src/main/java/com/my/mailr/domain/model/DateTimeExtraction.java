package com.my.mailr.domain.model;

import java.time.LocalDateTime;

/**
 * 왜: 본문에서 찾은 일시를 기록하되, 찾지 못한 경우도 정상 결과로 표현하기 위함.
 */
public record DateTimeExtraction(LocalDateTime datetime) implements StepOutput {

    public static DateTimeExtraction none() {
        return new DateTimeExtraction(null);
    }
}
