package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operator notification severity. Rank 1 is the most severe.
 */
public enum NotificationSeverity {
    CRITICAL("critical", 1),
    WARNING("warning", 2),
    INFO("info", 3);

    private final String label;
    private final int rank;

    NotificationSeverity(String label, int rank) {
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

    /**
     * True when this severity is at least as severe as {@code minimum}.
     */
    public boolean isAtLeast(NotificationSeverity minimum) {
        return rank <= minimum.rank;
    }

    @JsonCreator
    public static NotificationSeverity fromLabel(String label) {
        for (NotificationSeverity severity : values()) {
            if (severity.label.equalsIgnoreCase(label) || severity.name().equalsIgnoreCase(label)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown notification severity: " + label);
    }
}
