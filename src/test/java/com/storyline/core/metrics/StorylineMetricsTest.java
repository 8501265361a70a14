package com.storyline.core.metrics;

import com.storyline.core.model.DirectiveKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StorylineMetricsTest {

    private SimpleMeterRegistry registry;
    private StorylineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new StorylineMetrics(registry);
    }

    @Test
    @DisplayName("recordResolveDuration creates a timer")
    void recordResolveDuration() {
        metrics.recordResolveDuration(2_000_000);
        var timer = registry.find("storyline.resolve.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordSelection counts by lower-case kind tag")
    void recordSelection() {
        metrics.recordSelection(DirectiveKind.SHUFFLE);
        metrics.recordSelection(DirectiveKind.SHUFFLE);
        metrics.recordSelection(DirectiveKind.ONCE_ONLY);

        var shuffle = registry.find("storyline.directive.selections").tag("kind", "shuffle").counter();
        var onceOnly = registry.find("storyline.directive.selections").tag("kind", "once_only").counter();

        assertNotNull(shuffle);
        assertNotNull(onceOnly);
        assertEquals(2.0, shuffle.count());
        assertEquals(1.0, onceOnly.count());
    }

    @Test
    @DisplayName("recordError counts by type tag")
    void recordError() {
        metrics.recordError("syntax");
        metrics.recordError("evaluation");
        metrics.recordError("syntax");

        assertEquals(2.0, registry.find("storyline.errors").tag("type", "syntax").counter().count());
        assertEquals(1.0, registry.find("storyline.errors").tag("type", "evaluation").counter().count());
        assertNull(registry.find("storyline.errors").tag("type", "definition").counter());
    }

    @Test
    @DisplayName("recordReshuffle increments the reshuffle counter")
    void recordReshuffle() {
        metrics.recordReshuffle();
        assertEquals(1.0, registry.find("storyline.shuffle.reshuffles").counter().count());
    }

    @Test
    @DisplayName("recordDirectiveCount records a distribution summary")
    void recordDirectiveCount() {
        metrics.recordDirectiveCount(3);
        metrics.recordDirectiveCount(5);
        var summary = registry.find("storyline.document.directives").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(8.0, summary.totalAmount());
    }
}
