package com.storyline.core.selection;

import com.storyline.core.classify.DirectiveClassifier;
import com.storyline.core.expression.EvaluationException;
import com.storyline.core.expression.ExpressionEvaluator;
import com.storyline.core.expression.VariableContext;
import com.storyline.core.metrics.StorylineMetrics;
import com.storyline.core.model.Branch;
import com.storyline.core.model.Directive;
import com.storyline.core.model.DirectiveKind;
import com.storyline.core.model.SourceSpan;
import com.storyline.core.state.SequenceState;
import com.storyline.core.state.SequenceStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Chooses which branch of a directive is emitted in the current evaluation round.
 *
 * <p>List directives consult and mutate their {@link SequenceState}, keyed by the directive
 * identity. A branch whose guard is false is left out of the eligible set for the round but keeps
 * its index. When nothing is eligible the round emits nothing and the state is not touched, so a
 * transiently false guard never costs a directive its place in the sequence.
 *
 * <p>Not thread-safe: callers must serialize evaluations that share a store.
 */
public class SelectionEngine {

    private static final Logger log = LoggerFactory.getLogger(SelectionEngine.class);

    private final SequenceStateStore store;
    private final ExpressionEvaluator evaluator;
    private final RandomSource random;
    private final StorylineMetrics metrics;

    /**
     * @param metrics optional; null disables meter recording
     */
    public SelectionEngine(SequenceStateStore store, ExpressionEvaluator evaluator,
                           RandomSource random, StorylineMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.random = Objects.requireNonNull(random, "random");
        this.metrics = metrics;
    }

    /**
     * Selects the branch to emit for one evaluation of a directive.
     *
     * @return index into {@link Directive#branches()}, or empty when the directive emits nothing
     * @throws com.storyline.core.classify.DefinitionException if the branch count is invalid
     * @throws EvaluationException if a guard cannot be evaluated
     */
    public OptionalInt select(Directive directive, VariableContext context) {
        DirectiveClassifier.validate(directive);

        if (directive.kind() == DirectiveKind.CONDITIONAL) {
            return selectConditional(directive, context);
        }

        List<Integer> eligible = eligible(directive, context);
        if (eligible.isEmpty()) {
            log.debug("Directive {} ({}) has no eligible branch, emitting nothing",
                    directive.identity(), directive.kind());
            return OptionalInt.empty();
        }

        SequenceState state = store.getOrCreate(directive.identity());
        OptionalInt chosen = switch (directive.kind()) {
            case STOPPING -> stopping(state, eligible);
            case CYCLE -> cycle(state, eligible);
            case ONCE_ONLY -> onceOnly(directive, state, eligible);
            case SHUFFLE -> shuffle(directive, state, eligible);
            case CONDITIONAL -> throw new IllegalStateException("unreachable");
        };

        log.debug("Directive {} ({}): {} of {} branches eligible, chose {}",
                directive.identity(), directive.kind(), eligible.size(), directive.branches().size(),
                chosen.isPresent() ? chosen.getAsInt() : "nothing");
        if (chosen.isPresent() && metrics != null) {
            metrics.recordSelection(directive.kind());
        }
        return chosen;
    }

    // --- Disciplines ---

    private OptionalInt selectConditional(Directive directive, VariableContext context) {
        boolean result = evaluateGuard(directive.guard(), directive.guardSpan(), context);
        OptionalInt chosen;
        if (result) {
            chosen = OptionalInt.of(0);
        } else {
            chosen = directive.branches().size() == 2 ? OptionalInt.of(1) : OptionalInt.empty();
        }
        log.debug("Conditional {} guard '{}' is {}", directive.identity(), directive.guard(), result);
        if (chosen.isPresent() && metrics != null) {
            metrics.recordSelection(directive.kind());
        }
        return chosen;
    }

    private OptionalInt stopping(SequenceState state, List<Integer> eligible) {
        int index = eligible.get(Math.min(state.counter(), eligible.size() - 1));
        state.increment();
        return OptionalInt.of(index);
    }

    private OptionalInt cycle(SequenceState state, List<Integer> eligible) {
        int index = eligible.get(state.counter() % eligible.size());
        state.increment();
        return OptionalInt.of(index);
    }

    private OptionalInt onceOnly(Directive directive, SequenceState state, List<Integer> eligible) {
        if (state.counter() >= eligible.size()) {
            return OptionalInt.empty();
        }
        int index = eligible.get(state.counter());
        state.increment();
        if (state.counter() >= eligible.size()) {
            log.info("OnceOnly directive {} exhausted after {} branches", directive.identity(), state.counter());
        }
        return OptionalInt.of(index);
    }

    /**
     * Walks the persisted permutation, skipping entries that are not eligible this round. When the
     * permutation runs out a new one is drawn over the current eligible set; with more than one
     * eligible branch the entry emitted last never opens the new permutation.
     */
    private OptionalInt shuffle(Directive directive, SequenceState state, List<Integer> eligible) {
        List<Integer> order = state.hasShuffleOrder() ? state.order() : List.of();
        int cursor = state.hasShuffleOrder() ? state.cursor() : 0;

        int position = cursor;
        while (position < order.size() && !eligible.contains(order.get(position))) {
            position++;
        }

        if (position >= order.size()) {
            Integer lastEmitted = cursor > 0 && cursor <= order.size() ? order.get(cursor - 1) : null;
            order = permutation(eligible, lastEmitted);
            position = 0;
            if (state.hasShuffleOrder()) {
                log.info("Shuffle directive {} reshuffled to {}", directive.identity(), order);
            } else {
                log.debug("Shuffle directive {} drew initial order {}", directive.identity(), order);
            }
            if (metrics != null) {
                metrics.recordReshuffle();
            }
        }

        int index = order.get(position);
        state.updateShuffle(order, position + 1);
        state.increment();
        return OptionalInt.of(index);
    }

    private List<Integer> permutation(List<Integer> eligible, Integer lastEmitted) {
        var order = new ArrayList<>(eligible);
        for (int i = order.size() - 1; i > 0; i--) {
            Collections.swap(order, i, random.nextInt(i + 1));
        }
        if (order.size() > 1 && order.get(0).equals(lastEmitted)) {
            Collections.swap(order, 0, 1 + random.nextInt(order.size() - 1));
        }
        return order;
    }

    // --- Guards ---

    private List<Integer> eligible(Directive directive, VariableContext context) {
        var eligible = new ArrayList<Integer>(directive.branches().size());
        for (int i = 0; i < directive.branches().size(); i++) {
            Branch branch = directive.branch(i);
            if (!branch.hasGuard() || evaluateGuard(branch.guard(), branch.guardSpan(), context)) {
                eligible.add(i);
            }
        }
        return eligible;
    }

    private boolean evaluateGuard(String guard, SourceSpan span, VariableContext context) {
        try {
            return evaluator.evaluate(guard, context);
        } catch (EvaluationException e) {
            if (e.isLocated()) {
                throw e;
            }
            throw new EvaluationException(guard, span, e);
        } catch (RuntimeException e) {
            throw new EvaluationException(guard, span, e);
        }
    }
}
