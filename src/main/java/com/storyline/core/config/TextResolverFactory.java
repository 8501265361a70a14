package com.storyline.core.config;

import com.storyline.core.compose.ResolverOptions;
import com.storyline.core.compose.TextResolver;
import com.storyline.core.expression.ExpressionEvaluator;
import com.storyline.core.metrics.StorylineMetrics;
import com.storyline.core.selection.RandomSource;
import com.storyline.core.state.SequenceStateStore;

/**
 * Builds one {@link TextResolver} per narrative session from the application configuration.
 * The store and random source belong to the session and are supplied by the caller.
 */
public class TextResolverFactory {

    private final StorylineProperties properties;
    private final ExpressionEvaluator evaluator;
    private final StorylineMetrics metrics;

    public TextResolverFactory(StorylineProperties properties, ExpressionEvaluator evaluator,
                               StorylineMetrics metrics) {
        this.properties = properties;
        this.evaluator = evaluator;
        this.metrics = metrics;
    }

    public TextResolver create(SequenceStateStore store, RandomSource randomSource) {
        var options = ResolverOptions.builder()
                .store(store)
                .randomSource(randomSource)
                .evaluator(evaluator)
                .maxNestingDepth(properties.getMaxNestingDepth())
                .metrics(metrics)
                .build();
        return new TextResolver(options);
    }

    public StorylineProperties properties() {
        return properties;
    }
}
