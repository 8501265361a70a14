package com.storyline.core.model;

/**
 * Syntactic form a directive was authored in.
 */
public enum EmbedForm {
    /** {@code {a|b|c}} on a single line. */
    INLINE,
    /** A dash-bulleted list that opens with a newline right after the brace. */
    MULTI_LINE
}
