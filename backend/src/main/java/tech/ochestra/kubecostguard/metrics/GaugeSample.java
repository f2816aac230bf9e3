package tech.ochestra.kubecostguard.metrics;

import java.util.Map;

/**
 * One gauge value for the metrics exporter.
 */
public record GaugeSample(String name, Map<String, String> labels, double value) {

    public GaugeSample {
        labels = Map.copyOf(labels);
    }

    public static GaugeSample of(String name, double value) {
        return new GaugeSample(name, Map.of(), value);
    }
}
