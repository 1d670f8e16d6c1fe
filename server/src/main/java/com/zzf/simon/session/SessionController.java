package com.zzf.simon.session;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zzf.simon.infrastructure.CallerContext;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CreateSessionRequest {
        private String coachId;
        private String title;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Session create(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid,
                          @RequestBody(required = false) CreateSessionRequest request) {
        CreateSessionRequest req = request == null ? new CreateSessionRequest() : request;
        return sessionService.create(uid, req.getCoachId(), req.getTitle());
    }

    @GetMapping("/{id}")
    public Session get(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid, @PathVariable("id") String sessionId) {
        return sessionService.requireOwned(uid, sessionId);
    }

    @GetMapping("/{id}/messages")
    public List<Message> messages(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid, @PathVariable("id") String sessionId) {
        sessionService.requireOwned(uid, sessionId);
        return sessionService.getMessages(sessionId);
    }
}
