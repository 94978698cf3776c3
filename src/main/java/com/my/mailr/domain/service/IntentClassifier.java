package com.my.mailr.domain.service;

import com.my.mailr.domain.model.Intent;

import java.util.List;
import java.util.Locale;

/**
 * 왜: 제목과 본문의 키워드로 메일 의도를 결정하되, 여러 범주의 키워드가 섞여도 범주 순서로만 판정하기 위함.
 */
public class IntentClassifier {

    // 순서가 곧 우선순위다. 먼저 맞는 규칙이 이긴다.
    private static final List<IntentRule> RULES = List.of(
            new IntentRule(Intent.MEETING_REQUEST, List.of("meet", "meeting", "schedule", "call")),
            new IntentRule(Intent.INFO_REQUEST, List.of("please", "could you", "can you", "send")),
            new IntentRule(Intent.ACKNOWLEDGEMENT, List.of("thanks", "thank you", "acknowledge"))
    );

    public Intent classify(String subject, String body) {
        String text = (nullToEmpty(subject) + " " + nullToEmpty(body)).toLowerCase(Locale.ROOT);
        for (IntentRule rule : RULES) {
            if (rule.matches(text)) {
                return rule.intent();
            }
        }
        return Intent.GENERAL;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record IntentRule(Intent intent, List<String> keywords) {
        boolean matches(String lowered) {
            return keywords.stream().anyMatch(lowered::contains);
        }
    }
}
