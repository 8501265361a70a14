package com.storyline.core.expression;

/**
 * External capability that decides guard expressions.
 * <p>
 * The engine never interprets guard text itself; it passes the exact characters authored
 * before the condition's colon. Failures should be reported by throwing; the engine wraps them
 * in an {@link EvaluationException} carrying the guard and its source span.
 */
@FunctionalInterface
public interface ExpressionEvaluator {

    boolean evaluate(String guardSource, VariableContext context);

    /**
     * Evaluator for hosts that configure none: every guard fails.
     */
    static ExpressionEvaluator unsupported() {
        return (guardSource, context) -> {
            throw new EvaluationException("No expression evaluator configured");
        };
    }
}
