package com.my.mailr.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.mailr.config.AppConfig;
import com.my.mailr.domain.exception.CollaboratorFailureException;
import com.my.mailr.domain.exception.InvalidRequestException;
import com.my.mailr.domain.model.ActionResult;
import com.my.mailr.domain.model.MailMessage;
import com.my.mailr.domain.model.ProcessedMail;
import com.my.mailr.domain.port.in.ProcessMailUseCase;
import com.my.mailr.domain.port.out.ActionResultPublishPort;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.time.ZoneId;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 큐로 한 건씩 들어오는 메일을 도메인 유스케이스로 진입시키고 결과를 발행하는 단일 경로를 제공하기 위함.
 * 형식 오류는 버리고(ack), 협력자 실패는 nack으로 돌려보낸다.
 */
@ApplicationScoped
public class RabbitMailConsumer {

    private static final Logger log = Logger.getLogger(RabbitMailConsumer.class);

    private final ProcessMailUseCase processMailUseCase;
    private final ActionResultPublishPort actionResultPublishPort;
    private final ObjectMapper objectMapper;
    private final ZoneId zoneId;

    @Inject
    public RabbitMailConsumer(ProcessMailUseCase processMailUseCase,
                              ActionResultPublishPort actionResultPublishPort,
                              ObjectMapper objectMapper,
                              AppConfig appConfig) {
        this.processMailUseCase = processMailUseCase;
        this.actionResultPublishPort = actionResultPublishPort;
        this.objectMapper = objectMapper;
        this.zoneId = ZoneId.of(appConfig.clock().zone());
    }

    @Incoming("mail-requests")
    @Blocking
    public CompletionStage<Void> consume(Message<String> message) {
        MailMessage mail;
        try {
            IncomingMail incoming = objectMapper.readValue(message.getPayload(), IncomingMail.class);
            mail = incoming.toMailMessage(zoneId);
        } catch (IOException | InvalidRequestException e) {
            log.warnf("메일 파싱 실패로 처리 중단: %s", e.getMessage());
            return message.ack();
        }
        MDC.put("messageId", String.valueOf(mail.id()));
        try {
            ActionResult result = processMailUseCase.process(mail);
            actionResultPublishPort.publish(new ProcessedMail(mail, result));
            return message.ack();
        } catch (CollaboratorFailureException e) {
            log.errorf("협력자(%s) 실패로 메일 처리 실패: id=%d, %s", e.collaborator(), mail.id(), e.getMessage());
            return message.nack(e);
        } catch (RuntimeException e) {
            log.errorf("메일 처리 중 예외: id=%d, %s", mail.id(), e.getMessage());
            return message.nack(e);
        } finally {
            MDC.remove("messageId");
        }
    }
}
