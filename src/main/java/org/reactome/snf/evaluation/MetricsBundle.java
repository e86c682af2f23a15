package org.reactome.snf.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The metrics of one clustering outcome, e.g. "SNF-fused prediction".
 * @author wug
 *
 */
public final class MetricsBundle {
    private final String label;
    private final Map<String, Metric> metrics;

    public MetricsBundle(String label, List<Metric> metrics) {
        if (label == null || metrics == null)
            throw new IllegalArgumentException("label and metrics are required.");
        this.label = label;
        Map<String, Metric> map = new LinkedHashMap<>();
        for (Metric metric : metrics) {
            if (map.put(metric.getLabel(), metric) != null)
                throw new IllegalArgumentException("Duplicated metric: " + metric.getLabel());
        }
        this.metrics = Collections.unmodifiableMap(map);
    }

    public String getLabel() {
        return label;
    }

    public List<Metric> getMetrics() {
        return new ArrayList<>(metrics.values());
    }

    /**
     * @param metricLabel
     * @return null if there is no such metric in the bundle.
     */
    public Metric get(String metricLabel) {
        return metrics.get(metricLabel);
    }

    public double getValue(String metricLabel) {
        Metric metric = metrics.get(metricLabel);
        if (metric == null)
            throw new IllegalArgumentException(label + " has no metric named " + metricLabel);
        return metric.getValue();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(label).append(":");
        metrics.values().forEach(metric -> builder.append("\n\t").append(metric));
        return builder.toString();
    }

}
