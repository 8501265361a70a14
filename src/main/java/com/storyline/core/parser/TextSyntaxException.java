package com.storyline.core.parser;

import com.storyline.core.StorylineException;
import com.storyline.core.model.SourcePosition;
import com.storyline.core.model.SourceSpan;

import java.util.List;
import java.util.TreeSet;

/**
 * Thrown when authored text does not match the directive grammar.
 * <p>
 * The position is the furthest point the parser reached, and {@link #expected()} lists what
 * would have been accepted there. Resolution of the whole source is aborted.
 */
public class TextSyntaxException extends StorylineException {

    private final SourceSpan span;
    private final List<Expectation> expected;
    private final String found;

    public TextSyntaxException(String message, SourceSpan span, List<Expectation> expected, String found) {
        super(message);
        this.span = span;
        this.expected = List.copyOf(expected);
        this.found = found;
    }

    /**
     * Builds the standard "Expected ... but ... found." diagnostic.
     *
     * @param expected expectations collected at the failure position, duplicates allowed
     * @param found    the offending character, or null at end of input
     */
    public static TextSyntaxException of(List<Expectation> expected, String found, SourceSpan span) {
        var unique = List.copyOf(new TreeSet<>(expected));
        return new TextSyntaxException(buildMessage(unique, found), span, unique, found);
    }

    static String buildMessage(List<Expectation> expected, String found) {
        var descriptions = expected.stream().map(Expectation::description).distinct().sorted().toList();
        String expectedText;
        if (descriptions.isEmpty()) {
            expectedText = "nothing";
        } else if (descriptions.size() == 1) {
            expectedText = descriptions.get(0);
        } else if (descriptions.size() == 2) {
            expectedText = descriptions.get(0) + " or " + descriptions.get(1);
        } else {
            expectedText = String.join(", ", descriptions.subList(0, descriptions.size() - 1))
                    + ", or " + descriptions.get(descriptions.size() - 1);
        }
        String foundText = found != null ? "\"" + Expectation.escape(found, false) + "\"" : "end of input";
        return "Expected " + expectedText + " but " + foundText + " found.";
    }

    public SourcePosition position() {
        return span.start();
    }

    public SourceSpan span() {
        return span;
    }

    public List<Expectation> expected() {
        return expected;
    }

    /** The offending character, or null when the failure is at end of input. */
    public String found() {
        return found;
    }
}
