package com.my.mailr.adapter.out.inbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.mailr.adapter.in.rabbitmq.IncomingMail;
import com.my.mailr.config.AppConfig;
import com.my.mailr.domain.model.MailMessage;
import com.my.mailr.domain.port.out.InboxSourcePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

/**
 * 왜: sample_inbox.json 형식(메일 객체 배열)의 받은편지함 파일을 메일 목록으로 읽어 일괄 처리의 입력으로 쓰기 위함.
 */
@ApplicationScoped
public class JsonInboxFileAdapter implements InboxSourcePort {

    private final Path inboxPath;
    private final ZoneId zoneId;
    private final ObjectMapper objectMapper;

    @Inject
    public JsonInboxFileAdapter(AppConfig appConfig, ObjectMapper objectMapper) {
        this(Path.of(appConfig.inbox().path()), ZoneId.of(appConfig.clock().zone()), objectMapper);
    }

    JsonInboxFileAdapter(Path inboxPath, ZoneId zoneId, ObjectMapper objectMapper) {
        this.inboxPath = inboxPath;
        this.zoneId = zoneId;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<MailMessage> load() {
        if (!Files.exists(inboxPath)) {
            throw new IllegalStateException("받은편지함 파일이 없습니다: " + inboxPath);
        }
        try {
            IncomingMail[] incoming = objectMapper.readValue(inboxPath.toFile(), IncomingMail[].class);
            return Arrays.stream(incoming)
                    .map(mail -> mail.toMailMessage(zoneId))
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("받은편지함 파일 읽기 실패: " + inboxPath, e);
        }
    }
}
