package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An automated action together with its execution history.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationResponse {

    private String id;

    /** Situation that triggers the response, e.g. "High CPU Usage" */
    private String trigger;

    /** Action performed, e.g. "Scale up system resources" */
    private String action;

    @Builder.Default
    private ResponseStatus status = ResponseStatus.ACTIVE;

    private long successCount;

    private long failureCount;

    private Instant lastTriggered;

    @JsonIgnore
    public boolean isActive() {
        return status == ResponseStatus.ACTIVE;
    }

    public void recordSuccess(Instant at) {
        successCount++;
        lastTriggered = at;
    }

    public void recordFailure() {
        failureCount++;
    }
}
