package com.my.mailr.adapter.out.inbox;

import com.my.mailr.config.AppConfig;
import com.my.mailr.domain.model.InboxReport;
import com.my.mailr.domain.port.in.ProcessInboxUseCase;
import com.my.mailr.domain.port.out.InboxSourcePort;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * 왜: 설정이 켜져 있으면 기동 시 받은편지함 파일 전체를 한 번 처리해 데모/점검 흐름을 제공하기 위함.
 */
@Startup
@ApplicationScoped
public class InboxStartupRunner {

    private static final Logger log = Logger.getLogger(InboxStartupRunner.class);

    private final ProcessInboxUseCase processInboxUseCase;
    private final InboxSourcePort inboxSourcePort;
    private final boolean enabled;

    @Inject
    public InboxStartupRunner(ProcessInboxUseCase processInboxUseCase,
                              InboxSourcePort inboxSourcePort,
                              AppConfig appConfig) {
        this.processInboxUseCase = processInboxUseCase;
        this.inboxSourcePort = inboxSourcePort;
        this.enabled = appConfig.inbox().processOnStartup();
    }

    @PostConstruct
    void run() {
        if (!enabled) {
            return;
        }
        InboxReport report = processInboxUseCase.processAll(inboxSourcePort.load());
        log.infof("받은편지함 일괄 처리 완료: %d건", report.processed().size());
    }
}
