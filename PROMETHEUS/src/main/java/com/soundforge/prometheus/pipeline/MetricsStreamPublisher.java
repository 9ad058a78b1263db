package com.soundforge.prometheus.pipeline;

import com.soundforge.prometheus.config.PrometheusProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic synthetic system snapshot for live dashboards.
 * <p>
 * While running, a snapshot is emitted every {@code prometheus.stream.interval} to all
 * current subscribers of {@link #updates()}; frames emitted with no subscriber are dropped.
 */
@Slf4j
@Component
public class MetricsStreamPublisher {

    private final Duration interval;
    private final boolean autoStart;
    private final Scheduler scheduler;
    private final Clock clock;

    private final Sinks.Many<SystemMetricsSnapshot> sink = Sinks.many().multicast().directBestEffort();
    private final AtomicInteger activeConnections = new AtomicInteger();
    private Disposable task;

    @Autowired
    public MetricsStreamPublisher(PrometheusProperties properties, Clock clock) {
        this(properties, clock, Schedulers.parallel());
    }

    MetricsStreamPublisher(PrometheusProperties properties, Clock clock, Scheduler scheduler) {
        this.interval = properties.getStream().getInterval();
        this.autoStart = properties.getStream().isAutoStart();
        this.clock = clock;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autoStart) {
            start();
        }
    }

    /**
     * Start emitting. A running stream is restarted.
     */
    public synchronized void start() {
        stop();
        task = Flux.interval(interval, scheduler)
                .map(tick -> generateSnapshot())
                .subscribe(snapshot -> sink.tryEmitNext(snapshot),
                        error -> log.error("Metrics stream failed: {}", error.getMessage(), error));
        log.info("Metrics stream started with interval {}", interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (task != null) {
            task.dispose();
            task = null;
            log.info("Metrics stream stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDisposed();
    }

    public Flux<SystemMetricsSnapshot> updates() {
        return sink.asFlux();
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.updateAndGet(count -> Math.max(0, count - 1));
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    SystemMetricsSnapshot generateSnapshot() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return SystemMetricsSnapshot.builder()
                .timestamp(clock.instant())
                .system(SystemMetricsSnapshot.SystemLoad.builder()
                        .cpu(random.nextDouble() * 100)
                        .memory(random.nextDouble() * 100)
                        .activeConnections(activeConnections.get())
                        .build())
                .ai(SystemMetricsSnapshot.AiLoad.builder()
                        .requestsPerSecond(random.nextInt(50))
                        .successRate(85 + random.nextDouble() * 15)
                        .averageLatency(50 + random.nextDouble() * 100)
                        .build())
                .build();
    }
}
