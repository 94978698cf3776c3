package com.my.mailr.adapter.out.rabbitmq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.mailr.domain.model.ProcessedMail;
import com.my.mailr.domain.port.out.ActionResultPublishPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 왜: 처리 결과를 RabbitMQ로 전달하는 드리븐 어댑터를 분리해 대시보드 등 소비자와의 계약을 지키기 위함.
 */
@ApplicationScoped
public class ActionResultProducer implements ActionResultPublishPort {

    private static final Logger log = Logger.getLogger(ActionResultProducer.class);

    private final Emitter<String> emitter;
    private final ObjectMapper objectMapper;

    @Inject
    public ActionResultProducer(@Channel("mail-actions") Emitter<String> emitter,
                                ObjectMapper objectMapper) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(ProcessedMail processedMail) {
        try {
            String payload = objectMapper.writeValueAsString(ActionResultPayload.of(processedMail));
            emitter.send(payload);
        } catch (JsonProcessingException e) {
            log.warnf("처리 결과 직렬화 실패: id=%d, %s", processedMail.message().id(), e.getMessage());
        }
    }
}
