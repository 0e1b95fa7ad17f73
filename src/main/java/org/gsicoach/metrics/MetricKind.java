package org.gsicoach.metrics;

/** Per-player numeric series kept by the {@link MetricSampler}. */
public enum MetricKind {
    GPM("GPM"),
    XPM("XPM"),
    LAST_HITS("Last hits");

    private final String label;

    MetricKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
