package com.my.mailr.domain.service;

import com.my.mailr.domain.exception.CollaboratorFailureException;
import com.my.mailr.domain.model.ActionResult;
import com.my.mailr.domain.model.CreatedEvent;
import com.my.mailr.domain.model.DeliveryReceipt;
import com.my.mailr.domain.model.ExecutionContext;
import com.my.mailr.domain.model.Intent;
import com.my.mailr.domain.model.MailMessage;
import com.my.mailr.domain.model.OutgoingMail;
import com.my.mailr.domain.model.Plan;
import com.my.mailr.domain.model.ProcessingStage;
import com.my.mailr.domain.model.StepOutput;
import com.my.mailr.domain.model.StepType;
import com.my.mailr.domain.port.in.ProcessMailUseCase;
import com.my.mailr.domain.port.out.MailTransportPort;
import com.my.mailr.domain.service.step.WorkerStep;
import org.jboss.logging.Logger;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 왜: 분류, 계획, 단계 실행, 응답 합성, 전송을 메일 한 건 단위로 순서대로 연결하기 위함.
 * 메일 간에 공유하는 가변 상태가 없으므로 여러 스레드에서 동시에 호출해도 된다.
 */
public class MailOrchestratorService implements ProcessMailUseCase {

    private static final Logger log = Logger.getLogger(MailOrchestratorService.class);

    private final IntentClassifier intentClassifier;
    private final Planner planner;
    private final Map<StepType, WorkerStep> workers;
    private final ReplyGenerator replyGenerator;
    private final QualityAssurance qualityAssurance;
    private final MailTransportPort mailTransportPort;

    public MailOrchestratorService(IntentClassifier intentClassifier,
                                   Planner planner,
                                   List<WorkerStep> workerSteps,
                                   ReplyGenerator replyGenerator,
                                   QualityAssurance qualityAssurance,
                                   MailTransportPort mailTransportPort) {
        this.intentClassifier = intentClassifier;
        this.planner = planner;
        this.workers = new EnumMap<>(StepType.class);
        for (WorkerStep step : workerSteps) {
            if (!step.type().executable()) {
                throw new IllegalArgumentException("실행 불가능한 단계에 작업자를 등록할 수 없습니다: " + step.type());
            }
            this.workers.put(step.type(), step);
        }
        this.replyGenerator = replyGenerator;
        this.qualityAssurance = qualityAssurance;
        this.mailTransportPort = mailTransportPort;
    }

    @Override
    public ActionResult process(MailMessage message) {
        stage(message, ProcessingStage.RECEIVED);
        Intent intent = intentClassifier.classify(message.subject(), message.body());
        stage(message, ProcessingStage.CLASSIFIED);
        Plan plan = planner.plan(intent);
        stage(message, ProcessingStage.PLANNED);

        ExecutionContext context = new ExecutionContext();
        Map<StepType, StepOutput> outputs = new LinkedHashMap<>();
        for (StepType step : plan.steps()) {
            if (!step.executable()) {
                // draft_*/find_answer는 응답 생성기가 처리한다.
                continue;
            }
            WorkerStep worker = workers.get(step);
            if (worker == null) {
                throw new IllegalStateException("등록된 작업자가 없습니다: " + step.wireName());
            }
            outputs.put(step, worker.execute(message, context));
        }
        stage(message, ProcessingStage.STEPS_EXECUTED);

        String draft = replyGenerator.generate(message, intent, context);
        stage(message, ProcessingStage.REPLY_DRAFTED);
        String reply = qualityAssurance.finalizeReply(draft);
        stage(message, ProcessingStage.QA_FINALIZED);

        send(new OutgoingMail(message.id(), message.sender(), reply));
        ActionResult result = new ActionResult(plan, outputs, reply, true);
        stage(message, ProcessingStage.COMPLETED);
        log.infof("메일 처리 완료: id=%d, intent=%s, steps=%d, event=%s", message.id(), intent.wireName(), outputs.size(),
                context.createdEvent().map(CreatedEvent::eventId).orElse("-"));
        return result;
    }

    private void send(OutgoingMail mail) {
        DeliveryReceipt receipt;
        try {
            receipt = mailTransportPort.send(mail);
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException(CollaboratorFailureException.MAIL, "응답 메일 전송 실패", e);
        }
        if (receipt == null || !receipt.accepted()) {
            String detail = receipt == null ? "응답 없음" : receipt.detail();
            throw new CollaboratorFailureException(CollaboratorFailureException.MAIL, "응답 메일이 거부되었습니다: " + detail);
        }
    }

    private void stage(MailMessage message, ProcessingStage stage) {
        log.debugf("메일 %d -> %s", message.id(), stage);
    }
}
