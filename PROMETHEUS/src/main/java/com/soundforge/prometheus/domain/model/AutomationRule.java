package com.soundforge.prometheus.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Condition/action pair evaluated against every incoming metric point.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationRule {

    private String id;

    private String name;

    /** Human readable condition, e.g. "CPU Usage > 80% for 5 minutes" */
    private String condition;

    /** Human readable action, e.g. "Trigger auto-scale response" */
    private String action;

    /** Response executed when the rule matches */
    private String responseId;

    @Builder.Default
    private boolean enabled = true;

    @JsonIgnore
    private RuleCondition predicate;

    /**
     * Predicate deciding whether a rule fires for a metric point.
     */
    @FunctionalInterface
    public interface RuleCondition {
        boolean matches(MetricPoint metrics);
    }
}
