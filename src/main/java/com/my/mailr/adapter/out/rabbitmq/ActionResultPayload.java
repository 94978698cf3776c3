package com.my.mailr.adapter.out.rabbitmq;

import com.my.mailr.domain.model.ActionResult;
import com.my.mailr.domain.model.CreatedEvent;
import com.my.mailr.domain.model.DateTimeExtraction;
import com.my.mailr.domain.model.Plan;
import com.my.mailr.domain.model.ProcessedMail;
import com.my.mailr.domain.model.StepType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 처리 결과를 {email_id, plan, actions} 형태의 직렬화용 맵으로 바꾼다.
 */
final class ActionResultPayload {

    private ActionResultPayload() {
    }

    static Map<String, Object> of(ProcessedMail processed) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email_id", processed.message().id());
        payload.put("plan", plan(processed.result().plan()));
        payload.put("actions", actions(processed.result()));
        return payload;
    }

    private static Map<String, Object> plan(Plan plan) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("intent", plan.intent().wireName());
        body.put("steps", plan.steps().stream().map(StepType::wireName).toList());
        return body;
    }

    private static Map<String, Object> actions(ActionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        result.extraction().ifPresent(extraction ->
                body.put(StepType.EXTRACT_DATETIME.wireName(), extraction(extraction)));
        result.createdEvent().ifPresent(event ->
                body.put(StepType.CREATE_EVENT.wireName(), event(event)));
        body.put("reply", result.reply());
        body.put("sent", result.sent());
        return body;
    }

    private static Map<String, Object> extraction(DateTimeExtraction extraction) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("datetime", format(extraction.datetime()));
        return body;
    }

    private static Map<String, Object> event(CreatedEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event_id", event.eventId());
        body.put("status", event.status());
        body.put("summary", event.summary());
        body.put("datetime", format(event.datetime()));
        return body;
    }

    private static String format(LocalDateTime datetime) {
        return datetime == null ? null : DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(datetime);
    }
}
