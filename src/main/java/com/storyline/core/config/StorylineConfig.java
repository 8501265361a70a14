package com.storyline.core.config;

import com.storyline.core.expression.ExpressionEvaluator;
import com.storyline.core.expression.SimpleGuardEvaluator;
import com.storyline.core.metrics.StorylineMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring {@link Configuration} wiring the engine collaborators.
 * <p>
 * The engine classes themselves carry no Spring annotations so that hosts can build them
 * directly. A host that provides its own {@link ExpressionEvaluator} or {@link MeterRegistry}
 * bean replaces the defaults declared here.
 */
@Configuration
public class StorylineConfig {

    private static final Logger log = LoggerFactory.getLogger(StorylineConfig.class);

    @Bean
    @ConditionalOnMissingBean(ExpressionEvaluator.class)
    public ExpressionEvaluator expressionEvaluator() {
        return new SimpleGuardEvaluator();
    }

    /**
     * In-memory fallback registry, used when no monitoring backend is on the classpath.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        log.debug("No MeterRegistry available; using in-memory SimpleMeterRegistry");
        return new SimpleMeterRegistry();
    }

    @Bean
    public StorylineMetrics storylineMetrics(MeterRegistry registry) {
        return new StorylineMetrics(registry);
    }

    @Bean
    public TextResolverFactory textResolverFactory(StorylineProperties properties,
                                                   ExpressionEvaluator evaluator,
                                                   StorylineMetrics metrics) {
        return new TextResolverFactory(properties, evaluator, metrics);
    }
}
