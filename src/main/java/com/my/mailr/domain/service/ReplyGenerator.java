package com.my.mailr.domain.service;

import com.my.mailr.domain.model.ExecutionContext;
import com.my.mailr.domain.model.Intent;
import com.my.mailr.domain.model.MailMessage;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 왜: 의도별 응답 템플릿을 한곳에 모아 누적된 처리 결과(일시 등)를 응답 문구에 반영하기 위함.
 */
public class ReplyGenerator {

    static final DateTimeFormatter MEETING_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd hh:mm a", Locale.ENGLISH);
    static final String UNKNOWN_TIME = "a time";

    public String generate(MailMessage message, Intent intent, ExecutionContext context) {
        String body = switch (intent) {
            case MEETING_REQUEST -> "Thanks, that works for me. I've scheduled the meeting for "
                    + context.datetime().map(MEETING_FORMAT::format).orElse(UNKNOWN_TIME) + ".";
            case INFO_REQUEST -> "Thanks for reaching out. I will gather the information and send it shortly.";
            case ACKNOWLEDGEMENT -> "Thanks for the update, noted.";
            case GENERAL -> "Thanks for your message. I'll get back to you soon.";
        };
        return "Hi " + message.senderLocalPart() + ",\n\n" + body + "\n\n" + QualityAssurance.SIGNATURE;
    }
}
