package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator-facing health record of an AI provider.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderHealth {

    private String name;

    @Builder.Default
    private Status status = Status.ACTIVE;

    /** Synthetic health score, 0.0 to 1.0 */
    private double healthScore;

    private Instant lastCheck;

    private Limits limits;

    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    public ProviderHealth copy() {
        return toBuilder()
                .limits(limits.toBuilder().build())
                .capabilities(new ArrayList<>(capabilities))
                .build();
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Limits {
        private int requestsPerMinute;
        private int requestsPerDay;
        private int remaining;
    }

    public enum Status {
        ACTIVE("active"),
        DOWN("down");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        @JsonValue
        public String getLabel() {
            return label;
        }
    }
}
