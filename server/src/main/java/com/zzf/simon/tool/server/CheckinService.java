package com.zzf.simon.tool.server;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.id.Identifier;
import com.zzf.simon.id.Timestamps;
import com.zzf.simon.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

@Slf4j
@Service
public class CheckinService {
    static final String COLLECTION = "checkins";

    private final DocumentStore store;
    private final Clock clock;

    @Autowired
    public CheckinService(DocumentStore store) {
        this(store, Clock.systemUTC());
    }

    CheckinService(DocumentStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public ObjectNode schedule(String uid, String coachId, Checkin.Cadence cadence, String channel) {
        String now = Timestamps.now();
        Checkin checkin = Checkin.builder()
                .id(Identifier.random("checkin"))
                .uid(uid)
                .coachId(coachId)
                .cadence(cadence)
                .channel(channel)
                .nextRunAt(Timestamps.format(nextRun(cadence, ZonedDateTime.now(clock.withZone(ZoneOffset.UTC))).toInstant()))
                .status("active")
                .createdAt(now)
                .updatedAt(now)
                .build();
        store.put(COLLECTION, checkin.getId(), checkin);
        log.info("checkin.schedule uid={} checkin={} kind={} next={}", uid, checkin.getId(), cadence.getKind(), checkin.getNextRunAt());

        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("checkin_id", checkin.getId());
        result.put("status", "scheduled");
        result.put("next_run_at", checkin.getNextRunAt());
        return result;
    }

    /**
     * First matching hour:minute strictly after {@code now}. {@code custom_cron} is not interpreted and
     * falls back to the next daily occurrence.
     */
    static ZonedDateTime nextRun(Checkin.Cadence cadence, ZonedDateTime now) {
        ZonedDateTime candidate = now.withHour(cadence.getHour()).withMinute(cadence.getMinute()).withSecond(0).withNano(0);
        if (!candidate.isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        for (int i = 0; i < 8; i++) {
            if (matchesDay(cadence, candidate.getDayOfWeek())) {
                return candidate;
            }
            candidate = candidate.plusDays(1);
        }
        return candidate;
    }

    private static boolean matchesDay(Checkin.Cadence cadence, DayOfWeek day) {
        switch (cadence.getKind()) {
            case "weekdays":
                return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
            case "weekly":
                List<Integer> days = cadence.getWeekdays();
                if (days == null || days.isEmpty()) {
                    return day == DayOfWeek.MONDAY;
                }
                return days.contains(day.getValue());
            default:
                return true;
        }
    }
}
