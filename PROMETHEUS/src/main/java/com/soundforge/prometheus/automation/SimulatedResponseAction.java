package com.soundforge.prometheus.automation;

import com.soundforge.prometheus.config.PrometheusProperties;
import com.soundforge.prometheus.domain.model.AutomationResponse;
import com.soundforge.prometheus.domain.model.MetricPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Default {@link ResponseAction}: waits the configured action delay and logs the action.
 * No infrastructure is touched.
 */
@Slf4j
@Component
public class SimulatedResponseAction implements ResponseAction {

    private final Duration delay;
    private final Scheduler scheduler;

    @Autowired
    public SimulatedResponseAction(PrometheusProperties properties) {
        this(properties.getAutomation().getActionDelay(), Schedulers.parallel());
    }

    SimulatedResponseAction(Duration delay, Scheduler scheduler) {
        this.delay = delay;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<Void> perform(AutomationResponse response, MetricPoint metrics) {
        return Mono.delay(delay, scheduler)
                .doOnNext(tick -> log.info("Performing action: {} | response={}, metrics={}",
                        response.getAction(), response.getId(), metrics))
                .then();
    }
}
