package com.my.mailr.domain.port.in;

import com.my.mailr.domain.model.ActionResult;
import com.my.mailr.domain.model.MailMessage;

/**
 * 왜: 메일 한 건을 분류, 계획, 실행, 응답 합성까지 처리하는 단일 진입점을 제공하기 위함.
 */
public interface ProcessMailUseCase {
    ActionResult process(MailMessage message);
}
