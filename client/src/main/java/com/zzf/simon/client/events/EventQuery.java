package com.zzf.simon.client.events;

import lombok.Builder;
import lombok.Value;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

/**
 * Filters for the record list endpoints. Null fields are left to the server defaults
 * (limit 50, offset 0).
 */
@Value
@Builder
public class EventQuery {
    public static final EventQuery ALL = EventQuery.builder().build();

    String coachId;
    String status;
    Integer limit;
    Integer offset;

    public String toQueryString() {
        StringJoiner joiner = new StringJoiner("&");
        append(joiner, "coach_id", coachId);
        append(joiner, "status", status);
        append(joiner, "limit", limit == null ? null : String.valueOf(limit));
        append(joiner, "offset", offset == null ? null : String.valueOf(offset));
        String query = joiner.toString();
        return query.isEmpty() ? "" : "?" + query;
    }

    private static void append(StringJoiner joiner, String name, String value) {
        if (value != null && !value.isBlank()) {
            joiner.add(name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
    }
}
