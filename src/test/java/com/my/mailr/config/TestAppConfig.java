package com.my.mailr.config;

public class TestAppConfig implements AppConfig {

    private final String zone;
    private final String eventIdPrefix;
    private final String inboxPath;
    private final boolean processOnStartup;

    public TestAppConfig(String zone, String eventIdPrefix, String inboxPath, boolean processOnStartup) {
        this.zone = zone;
        this.eventIdPrefix = eventIdPrefix;
        this.inboxPath = inboxPath;
        this.processOnStartup = processOnStartup;
    }

    public static TestAppConfig defaults() {
        return new TestAppConfig("Asia/Seoul", "evt_", "./data/sample_inbox.json", false);
    }

    @Override
    public ClockConfig clock() {
        return () -> zone;
    }

    @Override
    public CalendarConfig calendar() {
        return () -> eventIdPrefix;
    }

    @Override
    public InboxConfig inbox() {
        return new InboxConfig() {
            @Override
            public String path() {
                return inboxPath;
            }

            @Override
            public boolean processOnStartup() {
                return processOnStartup;
            }
        };
    }
}
