package com.my.mailr.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    ClockConfig clock();

    CalendarConfig calendar();

    InboxConfig inbox();

    interface ClockConfig {
        @WithName("zone")
        @WithDefault("Asia/Seoul")
        String zone();
    }

    interface CalendarConfig {
        @WithName("event-id-prefix")
        @WithDefault("evt_")
        String eventIdPrefix();
    }

    interface InboxConfig {
        @WithName("path")
        @WithDefault("./data/sample_inbox.json")
        String path();

        @WithName("process-on-startup")
        @WithDefault("false")
        boolean processOnStartup();
    }
}
