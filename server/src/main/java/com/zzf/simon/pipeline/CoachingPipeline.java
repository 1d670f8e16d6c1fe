package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.envelope.EventType;
import com.zzf.simon.envelope.Payloads;
import com.zzf.simon.session.Message;
import com.zzf.simon.session.SessionService;
import com.zzf.simon.stream.EnvelopeSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Produces the envelopes of one turn after {@code stream.open}: deltas, {@code message.final}, tool requests,
 * cards and notices, then exactly one {@code stream.done} or {@code error}.
 * <p>
 * The pipeline never executes tools. A failure before the assistant message is stored discards the partial text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoachingPipeline {
    private final IntentRouter router;
    private final ContextBuilder contextBuilder;
    private final CoachAgent coachAgent;
    private final ToolProposer toolProposer;
    private final PlannerAgent plannerAgent;
    private final SafetyFilter safetyFilter;
    private final SessionService sessionService;

    public void run(PipelineInput input, EnvelopeSink sink) {
        String sessionId = input.getSession().getId();
        try {
            RouteDecision decision;
            try {
                decision = router.classify(input.getUserMessage());
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                fail(sink, "ROUTER_ERROR", "Failed to classify intent", e);
                return;
            }

            CoachContext context;
            try {
                context = contextBuilder.build(input.getUid(), input.getSession(), input.getUserMessageId(), decision.getRoute());
            } catch (RuntimeException e) {
                fail(sink, "CONTEXT_ERROR", "Failed to build context", e);
                return;
            }

            String reply;
            try {
                reply = coachAgent.reply(context, input.getUserMessage(), sink);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                fail(sink, "COACH_ERROR", "Failed to generate response", e);
                return;
            }
            if (!sink.isOpen()) {
                log.info("pipeline.abandoned session={} stage=coach", sessionId);
                return;
            }

            Message assistant;
            try {
                if (!sink.isOpen()) {
                    log.info("pipeline.abandoned session={} stage=persist", sessionId);
                    return;
                }
                assistant = sessionService.appendMessage(sessionId, Message.ROLE_ASSISTANT, reply);
            } catch (RuntimeException e) {
                fail(sink, "PERSISTENCE_ERROR", "Failed to save response", e);
                return;
            }
            sink.emit(EventType.MESSAGE_FINAL, Payloads.messageFinal(assistant.getId(), reply));

            List<ObjectNode> requests = toolProposer.propose(reply, input.getUserMessage(), context.getBlueprint());
            for (ObjectNode request : requests) {
                sink.emit(EventType.TOOL_REQUEST, request);
            }

            if (decision.getRoute().needsPlanner()) {
                emitCards(sink, reply);
            }

            Optional<String> notice = safetyFilter.check(reply, context.getBlueprint());
            notice.ifPresent(message -> sink.emit(EventType.POLICY_NOTICE, Payloads.policyNotice("safety_boundary", message)));

            sink.emit(EventType.STREAM_DONE, Payloads.streamDone("ok"));
            log.info("pipeline.done session={} route={} tools={} chars={}", sessionId, decision.getRoute().wire(), requests.size(), reply.length());
        } catch (CancellationException e) {
            log.info("pipeline.cancelled session={}", sessionId);
        } catch (RuntimeException e) {
            fail(sink, "INTERNAL_ERROR", "Internal error", e);
        }
    }

    private void emitCards(EnvelopeSink sink, String reply) {
        PlannerOutput output;
        try {
            output = plannerAgent.extract(reply);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("planner.failed err={}", e.toString());
            sink.emit(EventType.POLICY_NOTICE, Payloads.policyNotice("planner_warning", "Could not extract structured plan"));
            return;
        }
        if (output.getPlan() != null) {
            sink.emit(EventType.CARD_PLAN, Payloads.planCard(output.getPlan()));
        }
        if (output.getNextActions() != null) {
            sink.emit(EventType.CARD_NEXT_ACTIONS, Payloads.nextActionsCard(output.getNextActions()));
        }
        if (output.getWeeklyReview() != null) {
            sink.emit(EventType.CARD_WEEKLY_REVIEW, Payloads.weeklyReviewCard(output.getWeeklyReview()));
        }
    }

    private static void fail(EnvelopeSink sink, String code, String message, Exception cause) {
        log.warn("pipeline.error code={} err={}", code, cause.toString());
        sink.emit(EventType.ERROR, Payloads.error(code, message + ": " + cause.getMessage()));
    }
}
