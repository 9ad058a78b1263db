package com.soundforge.prometheus.api.v1;

import com.soundforge.prometheus.automation.AutomationEngine;
import com.soundforge.prometheus.automation.RuleUpdate;
import com.soundforge.prometheus.domain.model.AutomationResponse;
import com.soundforge.prometheus.domain.model.AutomationRule;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for automation rules and responses.
 */
@RestController
@RequestMapping("/api/v1/prometheus/automation")
@Tag(name = "Automation", description = "Automation rules and responses")
public class AutomationController {

    private final AutomationEngine automationEngine;

    public AutomationController(AutomationEngine automationEngine) {
        this.automationEngine = automationEngine;
    }

    @GetMapping("/rules")
    @Operation(summary = "List rules", description = "Automation rules in evaluation order")
    public Mono<ResponseEntity<List<AutomationRule>>> getRules() {
        return ApiResponses.ok(Mono.fromCallable(automationEngine::getRules), "Failed to fetch rules");
    }

    @PatchMapping("/rules/{id}")
    @Operation(summary = "Update rule", description = "Change the given fields of a rule")
    public Mono<ResponseEntity<AutomationRule>> updateRule(
            @Parameter(description = "Rule ID") @PathVariable String id,
            @RequestBody RuleUpdate update) {
        return ApiResponses.ok(Mono.fromCallable(() -> automationEngine.updateRule(id, update)),
                "Failed to update rule");
    }

    @GetMapping("/responses")
    @Operation(summary = "List responses", description = "Automated responses with execution counters")
    public Mono<ResponseEntity<List<AutomationResponse>>> getResponses() {
        return ApiResponses.ok(Mono.fromCallable(automationEngine::getResponses), "Failed to fetch responses");
    }

    @PostMapping("/responses/{id}/toggle")
    @Operation(summary = "Toggle response", description = "Switch a response between active and inactive")
    public Mono<ResponseEntity<AutomationResponse>> toggleResponse(
            @Parameter(description = "Response ID") @PathVariable String id) {
        return ApiResponses.ok(Mono.fromCallable(() -> automationEngine.toggleResponse(id)),
                "Failed to toggle response");
    }
}
