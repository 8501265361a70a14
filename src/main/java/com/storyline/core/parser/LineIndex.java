package com.storyline.core.parser;

import com.storyline.core.model.SourcePosition;
import com.storyline.core.model.SourceSpan;

import java.util.Arrays;

/**
 * Maps character offsets of one source string to line/column positions.
 * Built once per parse call.
 */
final class LineIndex {

    private final int[] lineStarts;

    LineIndex(String source) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    SourcePosition position(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        int line = idx >= 0 ? idx : -idx - 2;
        return new SourcePosition(offset, line + 1, offset - lineStarts[line] + 1);
    }

    SourceSpan span(int start, int end) {
        return new SourceSpan(position(start), position(end));
    }
}
