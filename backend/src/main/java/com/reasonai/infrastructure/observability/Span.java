package com.reasonai.infrastructure.observability;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One timed operation within a trace.
 */
@Getter
public class Span {

    private final String spanId;
    private final String traceId;
    private final String parentId;
    private final String name;
    private final long startNanos;
    private final Instant startedAt;
    private long endNanos = -1;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<String> events = new ArrayList<>();

    Span(String spanId, String traceId, String parentId, String name, Map<String, String> attributes) {
        this.spanId = spanId;
        this.traceId = traceId;
        this.parentId = parentId;
        this.name = name;
        this.startNanos = System.nanoTime();
        this.startedAt = Instant.now();
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
    }

    void end() {
        if (endNanos < 0) {
            endNanos = System.nanoTime();
        }
    }

    void addAttribute(String key, String value) {
        attributes.put(key, value);
    }

    void addEvent(String event) {
        events.add(Instant.now() + ": " + event);
    }

    public boolean isEnded() {
        return endNanos >= 0;
    }

    /**
     * @return elapsed milliseconds, or {@code null} while the span is open
     */
    public Double getDurationMs() {
        return isEnded() ? (endNanos - startNanos) / 1_000_000.0 : null;
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<String> getEvents() {
        return Collections.unmodifiableList(events);
    }
}
