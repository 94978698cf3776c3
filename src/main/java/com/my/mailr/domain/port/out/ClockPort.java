package com.my.mailr.domain.port.out;

import java.time.OffsetDateTime;

/**
 * 왜: 일시 추출의 기준 시각을 주입형으로 분리하여 테스트에서 고정할 수 있게 하기 위함.
 */
public interface ClockPort {
    OffsetDateTime now();
}
