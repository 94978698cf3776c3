package com.my.mailr.domain.model;

/**
 * 왜: 메일 의도를 닫힌 집합으로 고정하여 계획 수립과 응답 템플릿 분기 기준을 단순화하기 위함.
 */
public enum Intent {
    MEETING_REQUEST("meeting_request"),
    INFO_REQUEST("info_request"),
    ACKNOWLEDGEMENT("acknowledgement"),
    GENERAL("general");

    private final String wireName;

    Intent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
