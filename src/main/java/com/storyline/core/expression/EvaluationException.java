package com.storyline.core.expression;

import com.storyline.core.StorylineException;
import com.storyline.core.model.SourceSpan;

/**
 * Thrown when a guard expression cannot be evaluated.
 * <p>
 * Evaluators throw it without location; the engine rethrows it with the guard source text
 * and span attached.
 */
public class EvaluationException extends StorylineException {

    private final String guard;
    private final SourceSpan span;

    public EvaluationException(String message) {
        super(message);
        this.guard = null;
        this.span = null;
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
        this.guard = null;
        this.span = null;
    }

    public EvaluationException(String guard, SourceSpan span, Throwable cause) {
        super("Failed to evaluate guard '" + guard + "'"
                + (span != null ? " at " + span.start() : "")
                + ": " + cause.getMessage(), cause);
        this.guard = guard;
        this.span = span;
    }

    /** The guard source text, or null if not yet attributed to a guard. */
    public String guard() {
        return guard;
    }

    public SourceSpan span() {
        return span;
    }

    public boolean isLocated() {
        return guard != null;
    }
}
