package com.soundforge.prometheus.automation;

import com.soundforge.prometheus.domain.model.AutomationResponse;
import com.soundforge.prometheus.domain.model.MetricPoint;
import reactor.core.publisher.Mono;

/**
 * Performs the side effect of an automated response.
 * <p>
 * Completing empty means the action succeeded; an error signal marks the execution as failed.
 */
@FunctionalInterface
public interface ResponseAction {

    Mono<Void> perform(AutomationResponse response, MetricPoint metrics);
}
