package com.my.mailr.domain.service;

import com.my.mailr.domain.model.ExecutionContext;
import com.my.mailr.domain.model.Intent;
import com.my.mailr.domain.model.MailMessage;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ReplyGeneratorTest {

    private final ReplyGenerator generator = new ReplyGenerator();

    private final MailMessage message = new MailMessage(
            7, "dave.smith@example.org", "Hello", "body", OffsetDateTime.parse("2026-10-19T09:00:00Z"));

    @Test
    void meeting_reply_confirms_resolved_time() {
        ExecutionContext context = new ExecutionContext();
        context.recordDatetime(LocalDateTime.of(2026, 10, 20, 16, 0));

        String reply = generator.generate(message, Intent.MEETING_REQUEST, context);

        assertThat(reply).isEqualTo("Hi dave.smith,\n\n"
                + "Thanks, that works for me. I've scheduled the meeting for 2026-10-20 04:00 PM.\n\n"
                + "Best,\nSmartMailr");
    }

    @Test
    void meeting_reply_falls_back_to_a_time() {
        String reply = generator.generate(message, Intent.MEETING_REQUEST, new ExecutionContext());

        assertThat(reply).contains("I've scheduled the meeting for a time.");
    }

    @Test
    void every_template_greets_local_part_and_signs() {
        for (Intent intent : Intent.values()) {
            String reply = generator.generate(message, intent, new ExecutionContext());

            assertThat(reply).startsWith("Hi dave.smith,").endsWith(QualityAssurance.SIGNATURE);
        }
    }

    @Test
    void non_meeting_templates_are_fixed() {
        ExecutionContext context = new ExecutionContext();

        assertThat(generator.generate(message, Intent.INFO_REQUEST, context))
                .contains("I will gather the information and send it shortly.");
        assertThat(generator.generate(message, Intent.ACKNOWLEDGEMENT, context))
                .contains("Thanks for the update, noted.");
        assertThat(generator.generate(message, Intent.GENERAL, context))
                .contains("I'll get back to you soon.");
    }
}
