package com.storyline.core.parser;

import com.storyline.core.model.SourceSpan;

/**
 * Derives the stable identity of a directive from its document and source span.
 * <p>
 * Implementations must be deterministic: unchanged source parsed twice has to yield the
 * same identities, or persisted sequence state is lost.
 */
@FunctionalInterface
public interface IdentityNamer {

    String name(String documentId, SourceSpan span);

    /**
     * Default naming: {@code <documentId>@<offset>} using the offset of the opening brace.
     */
    static IdentityNamer byOffset() {
        return (documentId, span) -> documentId + "@" + span.start().offset();
    }
}
