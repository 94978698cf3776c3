package com.my.mailr.adapter.out.mail;

import com.my.mailr.domain.model.DeliveryReceipt;
import com.my.mailr.domain.model.OutgoingMail;
import com.my.mailr.domain.port.out.MailTransportPort;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * 왜: 실제 메일 발송 없이 응답 내용을 로그로 남기고 전송 완료로 응답하는 대역을 제공하기 위함.
 */
@ApplicationScoped
public class LoggingMailTransportAdapter implements MailTransportPort {

    private static final Logger log = Logger.getLogger(LoggingMailTransportAdapter.class);

    @Override
    public DeliveryReceipt send(OutgoingMail mail) {
        log.infof("응답 메일 전송(대역): to=%s, inReplyTo=%d%n%s", mail.recipient(), mail.inReplyTo(), mail.content());
        return DeliveryReceipt.accepted("mocked");
    }
}
