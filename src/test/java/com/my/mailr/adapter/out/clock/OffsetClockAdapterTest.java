package com.my.mailr.adapter.out.clock;

import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class OffsetClockAdapterTest {

    @Test
    void now_uses_configured_zone() {
        assertThat(OffsetClockAdapter.of("Asia/Seoul").now().getOffset()).isEqualTo(ZoneOffset.ofHours(9));
        assertThat(OffsetClockAdapter.of("UTC").now().getOffset()).isEqualTo(ZoneOffset.UTC);
    }
}
