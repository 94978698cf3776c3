package com.my.mailr.domain.port.out;

import com.my.mailr.domain.model.DeliveryReceipt;
import com.my.mailr.domain.model.OutgoingMail;

/**
 * 왜: 응답 메일 전송 채널을 숨기고 도메인이 단일 계약으로 전송을 요청하도록 하기 위함.
 */
public interface MailTransportPort {
    DeliveryReceipt send(OutgoingMail mail);
}
