package com.soundforge.prometheus.pipeline;

import com.soundforge.prometheus.support.TestComponents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricsStreamPublisher} on virtual time.
 */
class MetricsStreamPublisherTest {

    private TestComponents components;
    private VirtualTimeScheduler scheduler;
    private MetricsStreamPublisher publisher;
    private final List<SystemMetricsSnapshot> received = new CopyOnWriteArrayList<>();
    private Disposable subscription;

    @BeforeEach
    void setUp() {
        components = TestComponents.create();
        scheduler = VirtualTimeScheduler.create();
        publisher = new MetricsStreamPublisher(components.properties, components.clock, scheduler);
        subscription = publisher.updates().subscribe(received::add);
    }

    @AfterEach
    void tearDown() {
        subscription.dispose();
        publisher.stop();
        scheduler.dispose();
    }

    @Test
    @DisplayName("should emit one snapshot per interval while running")
    void emitsOnInterval() {
        publisher.start();

        scheduler.advanceTimeBy(Duration.ofSeconds(4));
        assertThat(received).isEmpty();

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertThat(received).hasSize(1);

        scheduler.advanceTimeBy(Duration.ofSeconds(10));
        assertThat(received).hasSize(3);
    }

    @Test
    @DisplayName("should stop emitting after stop")
    void stopHaltsStream() {
        publisher.start();
        assertThat(publisher.isRunning()).isTrue();

        publisher.stop();
        scheduler.advanceTimeBy(Duration.ofSeconds(30));

        assertThat(publisher.isRunning()).isFalse();
        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("should not double the rate when started twice")
    void restartKeepsSingleStream() {
        publisher.start();
        publisher.start();

        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("should report the number of open connections")
    void tracksConnections() {
        publisher.connectionOpened();
        publisher.connectionOpened();
        publisher.connectionClosed();
        publisher.connectionClosed();
        publisher.connectionClosed();

        assertThat(publisher.getActiveConnections()).isZero();

        publisher.connectionOpened();
        assertThat(publisher.generateSnapshot().getSystem().getActiveConnections()).isEqualTo(1);
    }

    @RepeatedTest(20)
    @DisplayName("should keep synthetic values in their ranges")
    void snapshotRanges() {
        SystemMetricsSnapshot snapshot = publisher.generateSnapshot();

        assertThat(snapshot.getTimestamp()).isEqualTo(components.clock.instant());
        assertThat(snapshot.getSystem().getCpu()).isBetween(0.0, 100.0);
        assertThat(snapshot.getSystem().getMemory()).isBetween(0.0, 100.0);
        assertThat(snapshot.getAi().getRequestsPerSecond()).isBetween(0, 49);
        assertThat(snapshot.getAi().getSuccessRate()).isBetween(85.0, 100.0);
        assertThat(snapshot.getAi().getAverageLatency()).isBetween(50.0, 150.0);
    }
}
