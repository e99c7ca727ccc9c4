package com.reasonai.infrastructure.observability;

import com.reasonai.domain.reasoning.model.StageType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects metric points for a single pipeline run. Not shared between runs.
 */
public class MetricsCollector {

    static final String STAGE_DURATION = "stage_duration_ms";
    static final String STAGE_LABEL = "stage";

    private final List<MetricPoint> points = new ArrayList<>();

    public void recordDuration(StageType stageType, double durationMs) {
        points.add(new MetricPoint(STAGE_DURATION, MetricPoint.Type.DURATION, durationMs,
                Map.of(STAGE_LABEL, stageType.key())));
    }

    public void incrementCounter(String name) {
        incrementCounter(name, 1.0);
    }

    public void incrementCounter(String name, double value) {
        points.add(new MetricPoint(name, MetricPoint.Type.COUNTER, value, Map.of()));
    }

    public void recordGauge(String name, double value) {
        points.add(new MetricPoint(name, MetricPoint.Type.GAUGE, value, Map.of()));
    }

    public List<MetricPoint> getMetrics() {
        return List.copyOf(points);
    }

    /**
     * Flatten the run's metrics: {@code <stage>_ms} per stage that ran, {@code stage_total_ms},
     * summed counters and the latest value of each gauge.
     */
    public Map<String, Double> getSummary() {
        Map<String, Double> summary = new LinkedHashMap<>();
        double total = 0;
        for (StageType type : StageType.values()) {
            double stageMs = 0;
            boolean seen = false;
            for (MetricPoint point : points) {
                if (point.type() == MetricPoint.Type.DURATION && type.key().equals(point.labels().get(STAGE_LABEL))) {
                    stageMs += point.value();
                    seen = true;
                }
            }
            if (seen) {
                summary.put(type.key() + "_ms", stageMs);
                total += stageMs;
            }
        }
        summary.put("stage_total_ms", total);

        for (MetricPoint point : points) {
            if (point.type() == MetricPoint.Type.COUNTER) {
                summary.merge(point.name(), point.value(), Double::sum);
            } else if (point.type() == MetricPoint.Type.GAUGE) {
                summary.put(point.name(), point.value());
            }
        }
        return summary;
    }

    public void clear() {
        points.clear();
    }
}
