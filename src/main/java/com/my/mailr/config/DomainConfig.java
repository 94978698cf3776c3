package com.my.mailr.config;

import com.my.mailr.adapter.out.clock.OffsetClockAdapter;
import com.my.mailr.domain.port.in.ProcessInboxUseCase;
import com.my.mailr.domain.port.in.ProcessMailUseCase;
import com.my.mailr.domain.port.out.ActionResultPublishPort;
import com.my.mailr.domain.port.out.CalendarPort;
import com.my.mailr.domain.port.out.ClockPort;
import com.my.mailr.domain.port.out.MailTransportPort;
import com.my.mailr.domain.service.InboxBatchService;
import com.my.mailr.domain.service.IntentClassifier;
import com.my.mailr.domain.service.MailOrchestratorService;
import com.my.mailr.domain.service.Planner;
import com.my.mailr.domain.service.QualityAssurance;
import com.my.mailr.domain.service.ReplyGenerator;
import com.my.mailr.domain.service.step.DateTimeExtractor;
import com.my.mailr.domain.service.step.EventCreator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.util.List;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 도메인이 CDI에 의존하지 않도록 하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public ProcessMailUseCase processMailUseCase(ClockPort clockPort,
                                                 CalendarPort calendarPort,
                                                 MailTransportPort mailTransportPort) {
        return new MailOrchestratorService(
                new IntentClassifier(),
                new Planner(),
                List.of(new DateTimeExtractor(clockPort), new EventCreator(calendarPort)),
                new ReplyGenerator(),
                new QualityAssurance(),
                mailTransportPort
        );
    }

    @Produces
    @ApplicationScoped
    public ProcessInboxUseCase processInboxUseCase(ProcessMailUseCase processMailUseCase,
                                                   ActionResultPublishPort actionResultPublishPort) {
        return new InboxBatchService(processMailUseCase, actionResultPublishPort);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.of(appConfig.clock().zone());
    }
}
