package com.storyline.core.metrics;

import com.storyline.core.model.DirectiveKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for text resolution.
 */
public class StorylineMetrics {

    private final MeterRegistry registry;

    public StorylineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordResolveDuration(long nanos) {
        Timer.builder("storyline.resolve.duration")
                .description("Time to parse, select and compose one text")
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordSelection(DirectiveKind kind) {
        Counter.builder("storyline.directive.selections")
                .description("Directive evaluations that emitted a branch")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records a failed resolution.
     *
     * @param type "syntax", "definition" or "evaluation"
     */
    public void recordError(String type) {
        Counter.builder("storyline.errors")
                .description("Resolution failures by error type")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordReshuffle() {
        Counter.builder("storyline.shuffle.reshuffles")
                .description("Shuffle directives that drew a new permutation")
                .register(registry)
                .increment();
    }

    public void recordDirectiveCount(int count) {
        DistributionSummary.builder("storyline.document.directives")
                .description("Number of directives per parsed document")
                .register(registry)
                .record(count);
    }
}
