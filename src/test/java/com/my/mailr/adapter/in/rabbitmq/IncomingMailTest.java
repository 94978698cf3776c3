package com.my.mailr.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.my.mailr.domain.exception.InvalidRequestException;
import com.my.mailr.domain.model.MailMessage;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IncomingMailTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsValidPayload() throws Exception {
        String payload = "{" +
                "\"id\":1," +
                "\"sender\":\"alice@example.com\"," +
                "\"subject\":\"Meeting?\"," +
                "\"body\":\"can we meet tomorrow?\"," +
                "\"received_at\":\"2026-10-19T09:12:00+09:00\"," +
                "\"labels\":[\"inbox\"]" +
                "}";

        MailMessage message = objectMapper.readValue(payload, IncomingMail.class).toMailMessage(SEOUL);

        assertThat(message.id()).isEqualTo(1L);
        assertThat(message.sender()).isEqualTo("alice@example.com");
        assertThat(message.subject()).isEqualTo("Meeting?");
        assertThat(message.body()).isEqualTo("can we meet tomorrow?");
        assertThat(message.receivedAt()).isEqualTo(OffsetDateTime.parse("2026-10-19T09:12:00+09:00"));
    }

    @Test
    void timestampWithoutOffsetUsesFallbackZone() {
        IncomingMail incoming = new IncomingMail(2L, "bob@example.com", "s", "b", "2026-10-19T09:12:00.123456");

        MailMessage message = incoming.toMailMessage(SEOUL);

        assertThat(message.receivedAt()).isEqualTo(OffsetDateTime.parse("2026-10-19T09:12:00.123456+09:00"));
    }

    @Test
    void rejectsMissingFields() {
        String payload = "{" +
                "\"id\":1," +
                "\"subject\":\"Meeting?\"," +
                "\"body\":\"hi\"," +
                "\"received_at\":\"2026-10-19T09:12:00+09:00\"" +
                "}";

        assertThrows(ValueInstantiationException.class,
                () -> objectMapper.readValue(payload, IncomingMail.class));
    }

    @Test
    void rejectsMalformedTimestamp() {
        IncomingMail incoming = new IncomingMail(3L, "carol@example.com", "s", "b", "yesterday");

        assertThrows(InvalidRequestException.class, () -> incoming.toMailMessage(SEOUL));
    }

    @Test
    void rejectsSenderWithoutAtSign() {
        IncomingMail incoming = new IncomingMail(4L, "carol", "s", "b", "2026-10-19T09:12:00+09:00");

        assertThrows(InvalidRequestException.class, () -> incoming.toMailMessage(SEOUL));
    }
}
