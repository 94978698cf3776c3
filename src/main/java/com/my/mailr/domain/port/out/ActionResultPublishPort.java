package com.my.mailr.domain.port.out;

import com.my.mailr.domain.model.ProcessedMail;

/**
 * 왜: 처리 결과를 소비하는 하류 시스템(대시보드 등)으로의 전달 경로를 도메인에서 분리하기 위함.
 */
public interface ActionResultPublishPort {
    void publish(ProcessedMail processedMail);
}
