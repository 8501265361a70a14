package com.storyline.core.model;

import java.io.Serializable;

/**
 * A half-open range {@code [start, end)} of source text captured at parse time.
 */
public record SourceSpan(SourcePosition start, SourcePosition end) implements Serializable {

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean contains(SourceSpan other) {
        return start.offset() <= other.start.offset() && other.end.offset() <= end.offset();
    }

    @Override
    public String toString() {
        return start.line() + ":" + start.column() + "-" + end.line() + ":" + end.column();
    }
}
