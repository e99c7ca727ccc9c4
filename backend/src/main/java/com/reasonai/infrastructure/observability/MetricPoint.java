package com.reasonai.infrastructure.observability;

import java.util.Map;

public record MetricPoint(String name, Type type, double value, Map<String, String> labels) {

    public enum Type {
        DURATION,
        COUNTER,
        GAUGE
    }

    public MetricPoint {
        labels = labels != null ? Map.copyOf(labels) : Map.of();
    }
}
