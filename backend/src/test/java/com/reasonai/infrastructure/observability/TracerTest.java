package com.reasonai.infrastructure.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TracerTest {

    @Test
    @DisplayName("spans nest under the active span and share the trace id")
    void nesting() {
        Tracer tracer = new Tracer("trace-1");

        Span root = tracer.startSpan("reasoning_pipeline", Map.of("prompt_length", "17"));
        Span child = tracer.startSpan("stage_preprocessing", Map.of());
        tracer.addAttribute(child, "status", "completed");
        tracer.addEvent(child, "cache miss");
        tracer.endSpan(child);
        Span sibling = tracer.startSpan("stage_working_awareness", Map.of());
        tracer.endSpan(sibling);
        tracer.endSpan(root);

        assertThat(tracer.getSpans()).containsExactly(root, child, sibling);
        assertThat(root.getParentId()).isNull();
        assertThat(child.getParentId()).isEqualTo(root.getSpanId());
        assertThat(sibling.getParentId()).isEqualTo(root.getSpanId());
        assertThat(tracer.getSpans()).allSatisfy(span -> {
            assertThat(span.getTraceId()).isEqualTo("trace-1");
            assertThat(span.isEnded()).isTrue();
            assertThat(span.getDurationMs()).isNotNull().isGreaterThanOrEqualTo(0.0);
        });
        assertThat(root.getAttributes()).containsEntry("prompt_length", "17");
        assertThat(child.getAttributes()).containsEntry("status", "completed");
        assertThat(child.getEvents()).singleElement().asString().endsWith("cache miss");
    }

    @Test
    @DisplayName("an open span has no duration yet")
    void openSpan() {
        Tracer tracer = new Tracer();

        Span span = tracer.startSpan("work", null);

        assertThat(span.getDurationMs()).isNull();
        assertThat(tracer.getTraceId()).isNotBlank();
    }
}
