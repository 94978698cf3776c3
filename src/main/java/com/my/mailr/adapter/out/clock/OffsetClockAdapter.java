package com.my.mailr.adapter.out.clock;

import com.my.mailr.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 설정된 시간대의 현재 시각을 주입형으로 제공해 일시 추출의 기준 날짜를 일관되게 하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private OffsetClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static OffsetClockAdapter of(String zone) {
        return new OffsetClockAdapter(ZoneId.of(zone));
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }
}
