package com.zzf.simon.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.client.events.CalendarEventRecord;
import com.zzf.simon.client.events.EventQuery;
import com.zzf.simon.client.events.NotificationRecord;
import com.zzf.simon.client.events.ReminderRecord;
import com.zzf.simon.client.stream.ChatStream;
import com.zzf.simon.client.stream.EnvelopeDecoder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * HTTP client for the Simon API. Every request carries {@code Authorization: Bearer <token>} from the
 * configured supplier; non-2xx answers become {@link SimonApiException} built from the server's
 * {@code {code, message}} body.
 */
@Slf4j
public class SimonApiClient implements AutoCloseable {
    private static final String JSON = "application/json";
    private static final int MAX_ERROR_BODY = 300;

    private final SimonClientConfig config;
    private final HttpClient http;
    private final ObjectMapper mapper;
    private final EnvelopeDecoder decoder;
    private final ExecutorService streamExecutor;

    public SimonApiClient(SimonClientConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getConnectTimeout()).build(), defaultMapper());
    }

    public SimonApiClient(SimonClientConfig config, HttpClient http, ObjectMapper mapper) {
        this.config = config;
        this.http = http;
        this.mapper = mapper;
        this.decoder = new EnvelopeDecoder(mapper);
        this.streamExecutor = Executors.newCachedThreadPool(daemonThreads());
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public SessionInfo createSession(String coachId, String title) {
        ObjectNode body = mapper.createObjectNode();
        if (coachId != null) {
            body.put("coach_id", coachId);
        }
        if (title != null) {
            body.put("title", title);
        }
        return send("POST", "/v1/sessions", body, type(SessionInfo.class));
    }

    /**
     * Starts one chat turn. The connection is opened in the background; failures surface from the
     * returned stream.
     */
    public ChatStream streamChat(String sessionId, String message) {
        ObjectNode body = mapper.createObjectNode().put("message", message);
        String path = "/v1/sessions/" + segment(sessionId) + "/stream";
        return ChatStream.start(() -> openStream(path, body), decoder, streamExecutor,
                config.getStreamConnectAttempts(), config.getStreamRetryDelay(), config.getStreamTimeout());
    }

    public ToolRunTicket executeTool(String toolId, String sessionId, JsonNode input) {
        ObjectNode body = mapper.createObjectNode();
        body.put("tool_id", toolId);
        if (sessionId != null) {
            body.put("session_id", sessionId);
        }
        body.set("input", input == null ? mapper.createObjectNode() : input);
        return send("POST", "/v1/tools/execute", body, type(ToolRunTicket.class));
    }

    public void submitToolResult(ToolResultReport report) {
        send("POST", "/v1/tools/result", report, null);
    }

    public ToolRunInfo getToolRun(String toolRunId) {
        return send("GET", "/v1/tools/runs/" + segment(toolRunId), null, type(ToolRunInfo.class));
    }

    public List<CalendarEventRecord> listCalendarEvents(EventQuery query) {
        return send("GET", "/v1/events/calendar" + queryString(query), null, type(new TypeReference<List<CalendarEventRecord>>() { }));
    }

    public List<ReminderRecord> listReminders(EventQuery query) {
        return send("GET", "/v1/events/reminders" + queryString(query), null, type(new TypeReference<List<ReminderRecord>>() { }));
    }

    public List<NotificationRecord> listNotifications(EventQuery query) {
        return send("GET", "/v1/events/notifications" + queryString(query), null, type(new TypeReference<List<NotificationRecord>>() { }));
    }

    public CalendarEventRecord saveCalendarEvent(CalendarEventRecord record) {
        return send("PUT", "/v1/events/calendar/" + segment(record.getId()), record, type(CalendarEventRecord.class));
    }

    public ReminderRecord saveReminder(ReminderRecord record) {
        return send("PUT", "/v1/events/reminders/" + segment(record.getId()), record, type(ReminderRecord.class));
    }

    public NotificationRecord saveNotification(NotificationRecord record) {
        return send("PUT", "/v1/events/notifications/" + segment(record.getId()), record, type(NotificationRecord.class));
    }

    public ReminderRecord completeReminder(String reminderId) {
        return send("PUT", "/v1/events/reminders/" + segment(reminderId) + "/complete", null, type(ReminderRecord.class));
    }

    public NotificationRecord cancelNotification(String notificationId) {
        return send("DELETE", "/v1/events/notifications/" + segment(notificationId), null, type(NotificationRecord.class));
    }

    @Override
    public void close() {
        streamExecutor.shutdownNow();
    }

    Stream<String> openStream(String path, JsonNode body) {
        HttpRequest request = request(path, config.getStreamTimeout())
                .setHeader("Accept", "text/event-stream")
                .POST(publisher(body))
                .build();
        HttpResponse<Stream<String>> response = execute(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() / 100 != 2) {
            String text;
            try (Stream<String> lines = response.body()) {
                text = lines.collect(Collectors.joining("\n"));
            }
            throw toException(response.statusCode(), text, response.headers());
        }
        log.debug("api.stream_open path={} status={}", path, response.statusCode());
        return response.body();
    }

    private <T> T send(String method, String path, Object body, JavaType responseType) {
        HttpRequest request = request(path, config.getRequestTimeout())
                .method(method, body == null ? HttpRequest.BodyPublishers.noBody() : publisher(body))
                .build();
        HttpResponse<String> response = execute(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        int status = response.statusCode();
        log.debug("api.request method={} path={} status={}", method, path, status);
        if (status / 100 != 2) {
            throw toException(status, response.body(), response.headers());
        }
        if (responseType == null || response.body() == null || response.body().isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(response.body(), responseType);
        } catch (JsonProcessingException e) {
            throw SimonApiException.decoding("could not decode " + method + " " + path + " response", e);
        }
    }

    private <T> HttpResponse<T> execute(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return http.send(request, handler);
        } catch (IOException e) {
            throw SimonApiException.network(request.method() + " " + request.uri().getPath() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SimonApiException.network("interrupted", e);
        }
    }

    private HttpRequest.Builder request(String path, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.normalizedBaseUrl() + path))
                .timeout(timeout)
                .header("Content-Type", JSON)
                .header("Accept", JSON);
        String token = config.getTokenSupplier() == null ? null : config.getTokenSupplier().get();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private HttpRequest.BodyPublisher publisher(Object body) {
        try {
            return HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body), StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw SimonApiException.decoding("could not encode request body", e);
        }
    }

    SimonApiException toException(int status, String body, HttpHeaders headers) {
        String code = "HTTP_" + status;
        String message = body == null ? "" : body;
        try {
            JsonNode node = body == null || body.isBlank() ? null : mapper.readTree(body);
            if (node != null && node.isObject()) {
                code = node.path("code").asText(code);
                message = node.path("message").asText(message);
            }
        } catch (JsonProcessingException e) {
            log.debug("api.error_body_not_json status={}", status);
        }
        if (message.length() > MAX_ERROR_BODY) {
            message = message.substring(0, MAX_ERROR_BODY);
        }
        Long retryAfter = headers.firstValue("Retry-After").map(SimonApiClient::parseSeconds).orElse(null);
        return SimonApiException.fromStatus(status, code, message, retryAfter);
    }

    private JavaType type(Class<?> type) {
        return mapper.getTypeFactory().constructType(type);
    }

    private JavaType type(TypeReference<?> type) {
        return mapper.getTypeFactory().constructType(type);
    }

    private static String queryString(EventQuery query) {
        return query == null ? "" : query.toQueryString();
    }

    private static String segment(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("path id is required");
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static Long parseSeconds(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "simon-stream-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
