package com.my.mailr.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationPropertiesTest {

    private static Properties load() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = ApplicationPropertiesTest.class.getResourceAsStream("/application.properties")) {
            assertThat(in).isNotNull();
            properties.load(in);
        }
        return properties;
    }

    @Test
    void eventIdPrefixIsBoundToEnvironmentVariable() throws IOException {
        assertThat(load().getProperty("app.calendar.event-id-prefix"))
                .isEqualTo("${CALENDAR_EVENT_ID_PREFIX:evt_}");
    }

    @Test
    void clockZoneIsBoundToEnvironmentVariable() throws IOException {
        assertThat(load().getProperty("app.clock.zone")).isEqualTo("${CLOCK_ZONE:Asia/Seoul}");
    }
}
