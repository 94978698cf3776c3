package com.my.mailr.domain.service;

import java.util.stream.Collectors;

/**
 * 왜: 응답 문안의 공백을 정리하고 서명을 보장하는 유일한 정규화 단계를 두기 위함.
 * 결과에 빈 줄이 남지 않으므로 두 번 적용해도 결과가 같다.
 */
public class QualityAssurance {

    public static final String SIGNATURE = "Best,\nSmartMailr";

    public String finalizeReply(String text) {
        String tidy = text == null ? "" : text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
        if (tidy.contains(SIGNATURE)) {
            return tidy;
        }
        return tidy.isEmpty() ? SIGNATURE : tidy + "\n" + SIGNATURE;
    }
}
