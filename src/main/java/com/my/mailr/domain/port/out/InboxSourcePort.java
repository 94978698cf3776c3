package com.my.mailr.domain.port.out;

import com.my.mailr.domain.model.MailMessage;

import java.util.List;

public interface InboxSourcePort {
    List<MailMessage> load();
}
