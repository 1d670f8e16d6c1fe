package com.zzf.simon.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.simon.api.ApiException;
import com.zzf.simon.config.SimonProperties;
import com.zzf.simon.envelope.EventType;
import com.zzf.simon.envelope.Payloads;
import com.zzf.simon.id.Timestamps;
import com.zzf.simon.infrastructure.CallerContext;
import com.zzf.simon.pipeline.CoachingPipeline;
import com.zzf.simon.pipeline.PipelineInput;
import com.zzf.simon.session.Message;
import com.zzf.simon.session.Session;
import com.zzf.simon.session.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * {@code POST /v1/sessions/{id}/stream}. Request problems are plain HTTP errors; once the event stream is
 * open every failure is an {@code error} envelope.
 */
@Slf4j
@RestController
public class ChatStreamController {
    private static final Duration EMITTER_GRACE = Duration.ofSeconds(30);

    private final SessionService sessionService;
    private final CoachingPipeline pipeline;
    private final StreamPump pump;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final SimonProperties properties;

    public ChatStreamController(SessionService sessionService,
                                CoachingPipeline pipeline,
                                StreamPump pump,
                                @Qualifier("streamExecutor") ExecutorService executor,
                                ObjectMapper objectMapper,
                                SimonProperties properties) {
        this.sessionService = sessionService;
        this.pipeline = pipeline;
        this.pump = pump;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostMapping("/v1/sessions/{id}/stream")
    public ResponseEntity<SseEmitter> stream(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid,
                                             @PathVariable("id") String sessionId,
                                             @RequestBody StreamChatRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw ApiException.validation("INVALID_MESSAGE", "message is required");
        }
        Session session = sessionService.requireOwned(uid, sessionId);
        Message userMessage = sessionService.appendMessage(sessionId, Message.ROLE_USER, request.getMessage());
        sessionService.touch(sessionId);

        SimonProperties.Stream cfg = properties.getStream();
        SseEmitter emitter = new SseEmitter(cfg.getTimeout().plus(EMITTER_GRACE).toMillis());
        StreamConnection connection = new StreamConnection(sessionId, cfg.getBufferSize());
        emitter.onCompletion(connection::cancel);
        emitter.onTimeout(connection::cancel);
        emitter.onError(e -> connection.cancel());

        connection.emit(EventType.STREAM_OPEN, Payloads.streamOpen(sessionId, Timestamps.now()));
        log.info("stream.open session={} uid={} message={}", sessionId, uid, userMessage.getId());

        PipelineInput input = PipelineInput.builder()
                .uid(uid)
                .session(session)
                .userMessageId(userMessage.getId())
                .userMessage(request.getMessage())
                .build();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        executor.execute(withMdc(mdc, () -> pump.pump(connection, new SseEmitterFrameWriter(emitter, objectMapper))));
        executor.execute(withMdc(mdc, () -> pipeline.run(input, connection)));

        return ResponseEntity.ok()
                .header("Cache-Control", "no-cache")
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }

    private static Runnable withMdc(Map<String, String> mdc, Runnable task) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        };
    }
}
