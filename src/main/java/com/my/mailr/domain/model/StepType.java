package com.my.mailr.domain.model;

/**
 * 왜: 계획에 들어갈 수 있는 단계를 닫힌 집합으로 두고 실행 가능 여부를 함께 표현하기 위함.
 */
public enum StepType {
    EXTRACT_DATETIME("extract_datetime", true),
    CREATE_EVENT("create_event", true),
    FIND_ANSWER("find_answer", false),
    DRAFT_REPLY("draft_reply", false),
    DRAFT_ACK("draft_ack", false),
    DRAFT_GENERAL_REPLY("draft_general_reply", false);

    private final String wireName;
    private final boolean executable;

    StepType(String wireName, boolean executable) {
        this.wireName = wireName;
        this.executable = executable;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * false인 단계는 응답 생성기가 암묵적으로 소비하는 자리표시자다.
     */
    public boolean executable() {
        return executable;
    }
}
