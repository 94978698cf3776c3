package com.my.mailr.domain.model;

public record InboxSummaryRow(long emailId, String sender, Intent intent, boolean sent) {

    public static InboxSummaryRow of(ProcessedMail processed) {
        return new InboxSummaryRow(
                processed.message().id(),
                processed.message().sender(),
                processed.result().intent(),
                processed.result().sent()
        );
    }
}
