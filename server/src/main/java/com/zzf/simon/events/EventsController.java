package com.zzf.simon.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.infrastructure.CallerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/events")
@RequiredArgsConstructor
public class EventsController {
    private final EventRecordService service;

    @GetMapping("/{kind}")
    public List<ObjectNode> list(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid,
                                 @PathVariable("kind") String kind,
                                 @RequestParam(value = "coach_id", required = false) String coachId,
                                 @RequestParam(value = "status", required = false) String status,
                                 @RequestParam(value = "limit", required = false) Integer limit,
                                 @RequestParam(value = "offset", required = false) Integer offset) {
        return service.list(uid, EventRecordType.fromPath(kind), coachId, status, limit, offset);
    }

    @PutMapping("/{kind}/{id}")
    public ObjectNode upsert(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid,
                             @PathVariable("kind") String kind,
                             @PathVariable("id") String id,
                             @RequestBody JsonNode body) {
        return service.upsert(uid, EventRecordType.fromPath(kind), id, body);
    }

    @PutMapping("/reminders/{id}/complete")
    public ObjectNode completeReminder(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid,
                                       @PathVariable("id") String id) {
        return service.completeReminder(uid, id);
    }

    @DeleteMapping("/notifications/{id}")
    public ObjectNode cancelNotification(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid,
                                         @PathVariable("id") String id) {
        return service.cancelNotification(uid, id);
    }
}
