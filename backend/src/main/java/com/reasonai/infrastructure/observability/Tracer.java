package com.reasonai.infrastructure.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records nested spans under one trace id. One tracer per pipeline run.
 */
public class Tracer {

    private final String traceId;
    private final List<Span> spans = new ArrayList<>();
    private Span activeSpan;

    public Tracer() {
        this(UUID.randomUUID().toString());
    }

    public Tracer(String traceId) {
        this.traceId = traceId;
    }

    public String getTraceId() {
        return traceId;
    }

    /**
     * Open a span as a child of the currently active span and make it active.
     */
    public Span startSpan(String name, Map<String, String> attributes) {
        String parentId = activeSpan != null ? activeSpan.getSpanId() : null;
        Span span = new Span(UUID.randomUUID().toString(), traceId, parentId, name, attributes);
        spans.add(span);
        activeSpan = span;
        return span;
    }

    /**
     * Close a span; if it was active, its parent becomes active again.
     */
    public void endSpan(Span span) {
        span.end();
        if (activeSpan == span) {
            activeSpan = span.getParentId() != null ? findSpan(span.getParentId()) : null;
        }
    }

    public void addEvent(Span span, String event) {
        span.addEvent(event);
    }

    public void addAttribute(Span span, String key, String value) {
        span.addAttribute(key, value);
    }

    public List<Span> getSpans() {
        return List.copyOf(spans);
    }

    private Span findSpan(String spanId) {
        for (Span span : spans) {
            if (span.getSpanId().equals(spanId)) {
                return span;
            }
        }
        return null;
    }
}
