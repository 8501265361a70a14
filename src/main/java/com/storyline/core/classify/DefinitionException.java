package com.storyline.core.classify;

import com.storyline.core.StorylineException;
import com.storyline.core.model.DirectiveKind;
import com.storyline.core.model.SourceSpan;

/**
 * Thrown on first resolution of a directive whose branch count breaks the contract of its kind.
 */
public class DefinitionException extends StorylineException {

    private final String identity;
    private final DirectiveKind kind;
    private final SourceSpan span;

    public DefinitionException(String message, String identity, DirectiveKind kind, SourceSpan span) {
        super(message + " [" + identity + " at " + span.start() + "]");
        this.identity = identity;
        this.kind = kind;
        this.span = span;
    }

    public String identity() {
        return identity;
    }

    public DirectiveKind kind() {
        return kind;
    }

    public SourceSpan span() {
        return span;
    }
}
