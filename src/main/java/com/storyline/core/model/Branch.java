package com.storyline.core.model;

import java.util.List;

/**
 * One candidate fragment of a directive.
 *
 * @param guard     opaque guard expression; only multi-line list entries carry one, otherwise null
 * @param guardSpan span of the guard expression text, null when there is no guard
 * @param content   parsed content in document order; may itself contain directives
 * @param span      span of the whole branch (guard included)
 */
public record Branch(
    String guard,
    SourceSpan guardSpan,
    List<ParsedNode> content,
    SourceSpan span
) {

    public Branch {
        content = List.copyOf(content);
    }

    public boolean hasGuard() {
        return guard != null;
    }
}
