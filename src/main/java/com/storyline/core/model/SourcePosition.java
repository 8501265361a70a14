package com.storyline.core.model;

import java.io.Serializable;

/**
 * A location inside authored source text.
 *
 * @param offset zero-based character offset into the source
 * @param line   1-based line number; only {@code \n} starts a new line
 * @param column 1-based column within the line
 */
public record SourcePosition(int offset, int line, int column) implements Serializable {

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
