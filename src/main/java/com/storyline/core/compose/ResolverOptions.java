package com.storyline.core.compose;

import com.storyline.core.expression.ExpressionEvaluator;
import com.storyline.core.localization.LocalizationProvider;
import com.storyline.core.localization.LocalizationStage;
import com.storyline.core.metrics.StorylineMetrics;
import com.storyline.core.parser.EmbedParser;
import com.storyline.core.parser.IdentityNamer;
import com.storyline.core.selection.RandomSource;
import com.storyline.core.selection.SeededRandomSource;
import com.storyline.core.state.InMemorySequenceStateStore;
import com.storyline.core.state.SequenceStateStore;

import java.util.Objects;

/**
 * Configuration bundle for a {@link TextResolver}. Immutable; create one with {@link #builder()}.
 */
public final class ResolverOptions {

    private final IdentityNamer identityNamer;
    private final SequenceStateStore store;
    private final ExpressionEvaluator evaluator;
    private final RandomSource randomSource;
    private final int maxNestingDepth;
    private final LocalizationProvider localization;
    private final LocalizationStage localizationStage;
    private final StorylineMetrics metrics;

    private ResolverOptions(Builder builder) {
        this.identityNamer = builder.identityNamer;
        this.store = builder.store != null ? builder.store : new InMemorySequenceStateStore();
        this.evaluator = builder.evaluator;
        this.randomSource = builder.randomSource != null ? builder.randomSource : new SeededRandomSource(0L);
        this.maxNestingDepth = builder.maxNestingDepth;
        this.localization = builder.localization;
        this.localizationStage = builder.localizationStage;
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options with every default: offset-based identities, a fresh in-memory store, no expression
     * evaluator, a random source seeded with 0 and a nesting limit of 64.
     */
    public static ResolverOptions defaults() {
        return builder().build();
    }

    public IdentityNamer identityNamer() {
        return identityNamer;
    }

    public SequenceStateStore store() {
        return store;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public RandomSource randomSource() {
        return randomSource;
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    /** Localization provider, or null when none is configured. */
    public LocalizationProvider localization() {
        return localization;
    }

    public LocalizationStage localizationStage() {
        return localizationStage;
    }

    /** Metrics sink, or null when metrics are not recorded. */
    public StorylineMetrics metrics() {
        return metrics;
    }

    public static final class Builder {

        private IdentityNamer identityNamer = IdentityNamer.byOffset();
        private SequenceStateStore store;
        private ExpressionEvaluator evaluator = ExpressionEvaluator.unsupported();
        private RandomSource randomSource;
        private int maxNestingDepth = EmbedParser.DEFAULT_MAX_DEPTH;
        private LocalizationProvider localization;
        private LocalizationStage localizationStage = LocalizationStage.AFTER_COMPOSE;
        private StorylineMetrics metrics;

        private Builder() {
        }

        public Builder identityNamer(IdentityNamer identityNamer) {
            this.identityNamer = Objects.requireNonNull(identityNamer, "identityNamer");
            return this;
        }

        public Builder store(SequenceStateStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        public Builder evaluator(ExpressionEvaluator evaluator) {
            this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
            return this;
        }

        public Builder randomSource(RandomSource randomSource) {
            this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            if (maxNestingDepth < 1) {
                throw new IllegalArgumentException("maxNestingDepth must be at least 1: " + maxNestingDepth);
            }
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder localization(LocalizationProvider localization, LocalizationStage stage) {
            this.localization = Objects.requireNonNull(localization, "localization");
            this.localizationStage = Objects.requireNonNull(stage, "stage");
            return this;
        }

        public Builder metrics(StorylineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }
    }
}
