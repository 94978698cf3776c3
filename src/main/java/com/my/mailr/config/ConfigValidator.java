package com.my.mailr.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateZone("CLOCK_ZONE", appConfig.clock().zone());
        validateRequired("CALENDAR_EVENT_ID_PREFIX", appConfig.calendar().eventIdPrefix(), isProd);
        if (appConfig.inbox().processOnStartup()) {
            validatePath("INBOX_PATH", appConfig.inbox().path(), isProd);
        }
    }

    private void validateZone(String name, String zone) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("시간대 설정이 올바르지 않습니다: " + name + "=" + zone, e);
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validatePath(String name, String path, boolean strict) {
        Path resolved = Path.of(path);
        if (!Files.exists(resolved)) {
            String message = "경로가 존재하지 않습니다: " + name + "=" + path;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }
}
