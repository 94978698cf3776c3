package com.my.mailr.domain.service;

import com.my.mailr.domain.model.*;
import com.my.mailr.domain.port.in.ProcessMailUseCase;
import com.my.mailr.domain.port.out.ActionResultPublishPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class InboxBatchServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-10-19T09:00:00+09:00");

    private ProcessMailUseCase processMailUseCase;
    private ActionResultPublishPort publishPort;
    private InboxBatchService service;

    @BeforeEach
    void setUp() {
        processMailUseCase = mock(ProcessMailUseCase.class);
        publishPort = mock(ActionResultPublishPort.class);
        service = new InboxBatchService(processMailUseCase, publishPort);
    }

    @Test
    void processes_in_order_and_summarizes() {
        MailMessage first = new MailMessage(1, "alice@example.com", "Meeting?", "meet", NOW);
        MailMessage second = new MailMessage(2, "bob@example.com", "Request", "send it", NOW);
        ActionResult meeting = result(Intent.MEETING_REQUEST);
        ActionResult info = result(Intent.INFO_REQUEST);
        when(processMailUseCase.process(first)).thenReturn(meeting);
        when(processMailUseCase.process(second)).thenReturn(info);

        InboxReport report = service.processAll(List.of(first, second));

        InOrder inOrder = inOrder(processMailUseCase, publishPort);
        inOrder.verify(processMailUseCase).process(first);
        inOrder.verify(publishPort).publish(new ProcessedMail(first, meeting));
        inOrder.verify(processMailUseCase).process(second);
        inOrder.verify(publishPort).publish(new ProcessedMail(second, info));
        assertThat(report.summary()).containsExactly(
                new InboxSummaryRow(1, "alice@example.com", Intent.MEETING_REQUEST, true),
                new InboxSummaryRow(2, "bob@example.com", Intent.INFO_REQUEST, true)
        );
    }

    @Test
    void empty_inbox_yields_empty_report() {
        InboxReport report = service.processAll(List.of());

        assertThat(report.processed()).isEmpty();
        assertThat(report.summary()).isEmpty();
        verifyNoInteractions(processMailUseCase, publishPort);
    }

    @Test
    void published_entry_carries_original_message() {
        MailMessage message = new MailMessage(9, "carol@example.com", "Thanks", "thanks", NOW);
        when(processMailUseCase.process(message)).thenReturn(result(Intent.ACKNOWLEDGEMENT));

        service.processAll(List.of(message));

        ArgumentCaptor<ProcessedMail> captor = ArgumentCaptor.forClass(ProcessedMail.class);
        verify(publishPort).publish(captor.capture());
        assertThat(captor.getValue().message()).isSameAs(message);
    }

    private static ActionResult result(Intent intent) {
        return new ActionResult(new Planner().plan(intent), Map.of(), "reply", true);
    }
}
