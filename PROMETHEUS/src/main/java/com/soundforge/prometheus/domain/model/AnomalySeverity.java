package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a detected anomaly. Threshold checks grade {@code high}/{@code medium};
 * forecast deviations grade {@code critical}/{@code warning}/{@code info}.
 * A lower rank is more severe.
 */
public enum AnomalySeverity {
    CRITICAL("critical", 1),
    HIGH("high", 2),
    WARNING("warning", 3),
    MEDIUM("medium", 4),
    INFO("info", 5);

    private final String label;
    private final int rank;

    AnomalySeverity(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    public boolean isMoreSevereThan(AnomalySeverity other) {
        return rank < other.rank;
    }

    /**
     * Severity used when the anomaly is surfaced to operators.
     */
    public NotificationSeverity toNotificationSeverity() {
        return switch (this) {
            case CRITICAL -> NotificationSeverity.CRITICAL;
            case HIGH, WARNING -> NotificationSeverity.WARNING;
            case MEDIUM, INFO -> NotificationSeverity.INFO;
        };
    }
}
