package com.my.mailr.domain.port.in;

import com.my.mailr.domain.model.InboxReport;
import com.my.mailr.domain.model.MailMessage;

import java.util.List;

/**
 * 왜: 받은편지함 묶음을 입력 순서대로 처리하고 요약을 돌려주기 위함.
 */
public interface ProcessInboxUseCase {
    InboxReport processAll(List<MailMessage> messages);
}
