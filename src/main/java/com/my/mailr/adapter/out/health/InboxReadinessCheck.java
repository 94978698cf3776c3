package com.my.mailr.adapter.out.health;

import com.my.mailr.config.AppConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class InboxReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;

    public InboxReadinessCheck(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        Path inbox = Path.of(appConfig.inbox().path());
        boolean required = appConfig.inbox().processOnStartup();
        boolean inboxOk = Files.exists(inbox);
        return HealthCheckResponse.named("mailr-readiness")
                .withData("inboxPath", inbox.toString())
                .withData("inboxExists", inboxOk)
                .withData("processOnStartup", required)
                .status(!required || inboxOk)
                .build();
    }
}
