package com.soundforge.prometheus.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of an automation rule. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleUpdate {

    private String name;
    private String condition;
    private String action;
    private String responseId;
    private Boolean enabled;
}
