package com.my.mailr.domain.model;

import java.util.List;

/**
 * 왜: 일괄 처리 결과와 요약 행을 입력 순서대로 묶어 반환하기 위함.
 */
public record InboxReport(List<ProcessedMail> processed) {
    public InboxReport {
        processed = processed == null ? List.of() : List.copyOf(processed);
    }

    public List<InboxSummaryRow> summary() {
        return processed.stream().map(InboxSummaryRow::of).toList();
    }
}
