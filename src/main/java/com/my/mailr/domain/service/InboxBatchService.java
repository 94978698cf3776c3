package com.my.mailr.domain.service;

import com.my.mailr.domain.model.ActionResult;
import com.my.mailr.domain.model.InboxReport;
import com.my.mailr.domain.model.InboxSummaryRow;
import com.my.mailr.domain.model.MailMessage;
import com.my.mailr.domain.model.ProcessedMail;
import com.my.mailr.domain.port.in.ProcessInboxUseCase;
import com.my.mailr.domain.port.in.ProcessMailUseCase;
import com.my.mailr.domain.port.out.ActionResultPublishPort;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 받은편지함 묶음을 입력 순서대로 한 건씩 처리하고 결과를 발행한 뒤 요약을 남기기 위함.
 */
public class InboxBatchService implements ProcessInboxUseCase {

    private static final Logger log = Logger.getLogger(InboxBatchService.class);

    private final ProcessMailUseCase processMailUseCase;
    private final ActionResultPublishPort actionResultPublishPort;

    public InboxBatchService(ProcessMailUseCase processMailUseCase,
                             ActionResultPublishPort actionResultPublishPort) {
        this.processMailUseCase = processMailUseCase;
        this.actionResultPublishPort = actionResultPublishPort;
    }

    @Override
    public InboxReport processAll(List<MailMessage> messages) {
        List<ProcessedMail> processed = new ArrayList<>(messages.size());
        for (MailMessage message : messages) {
            log.infof("메일 처리 시작: id=%d, sender=%s, subject=%s", message.id(), message.sender(), message.subject());
            ActionResult result = processMailUseCase.process(message);
            ProcessedMail entry = new ProcessedMail(message, result);
            actionResultPublishPort.publish(entry);
            processed.add(entry);
        }
        InboxReport report = new InboxReport(processed);
        for (InboxSummaryRow row : report.summary()) {
            log.infof("%d %s %s %s", row.emailId(), row.sender(), row.intent().wireName(), row.sent());
        }
        return report;
    }
}
