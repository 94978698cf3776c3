package com.my.mailr.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.my.mailr.domain.exception.InvalidRequestException;
import com.my.mailr.domain.model.MailMessage;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * 왜: 큐와 받은편지함 파일로 들어오는 메일 JSON의 필수 필드를 역직렬화 시점에 검증하기 위함.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingMail(Long id,
                           String sender,
                           String subject,
                           String body,
                           @JsonProperty("received_at") String receivedAt) {

    public IncomingMail {
        if (id == null || sender == null || subject == null || body == null || receivedAt == null) {
            throw new InvalidRequestException("메일 필수 필드가 비어 있습니다.");
        }
        if (sender.isBlank()) {
            throw new InvalidRequestException("발신자가 비어 있습니다.");
        }
    }

    /**
     * 오프셋이 없는 received_at은 fallbackZone 기준의 현지 시각으로 해석한다.
     */
    public MailMessage toMailMessage(ZoneId fallbackZone) {
        return new MailMessage(id, sender, subject, body, parseReceivedAt(fallbackZone));
    }

    private OffsetDateTime parseReceivedAt(ZoneId fallbackZone) {
        try {
            return OffsetDateTime.parse(receivedAt);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(receivedAt).atZone(fallbackZone).toOffsetDateTime();
            } catch (DateTimeParseException nested) {
                throw new InvalidRequestException("received_at 형식이 올바르지 않습니다: " + receivedAt, nested);
            }
        }
    }
}
