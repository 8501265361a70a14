package com.storyline.core.parser;

import com.storyline.core.classify.DirectiveClassifier;
import com.storyline.core.model.Branch;
import com.storyline.core.model.Directive;
import com.storyline.core.model.DirectiveKind;
import com.storyline.core.model.EmbedForm;
import com.storyline.core.model.ParsedDocument;
import com.storyline.core.model.ParsedNode;
import com.storyline.core.model.SourceSpan;
import com.storyline.core.model.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Backtracking recursive-descent parser for narrative text with embedded directives.
 * <p>
 * Grammar (PEG, ordered choice):
 * <pre>
 * Source             = (Text | Embed)*
 * Embed              = InlineEmbed | MultiLineEmbed
 * InlineEmbed        = '{' (Condition | Type)? Arguments '}'
 * Arguments          = Argument ('|' Argument)*
 * Argument           = (InlineText | Embed)*
 * MultiLineEmbed     = '{' Type? Newline Whitespace ('-' Whitespace MultilineArgument Whitespace)+ '}'
 * MultilineArgument  = Condition? (MultilineText | Embed)*
 * Type               = 'stopping:' | '~' | 'shuffle:' | '&amp;' | 'cycle:' | '!' | 'once:'
 * Condition          = [^\n|:{}]+ ':' Whitespace
 * Newline            = '\r'? '\n'
 * Whitespace         = [ \t\n\r]*
 * Text               = [^{}]+
 * InlineText         = [^{}|\r\n]+
 * MultilineText      = [^{}\-]+
 * </pre>
 * On failure the error reports the furthest offset any alternative reached, with every
 * expectation recorded at that offset.
 * <p>
 * Instances are immutable and may be shared; all parse state lives in a per-call run.
 */
public class EmbedParser {

    private static final Logger log = LoggerFactory.getLogger(EmbedParser.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final Expectation OPEN_BRACE = Expectation.literal("{");
    private static final Expectation CLOSE_BRACE = Expectation.literal("}");
    private static final Expectation PIPE = Expectation.literal("|");
    private static final Expectation DASH = Expectation.literal("-");
    private static final Expectation COLON = Expectation.literal(":");
    private static final Expectation CR = Expectation.literal("\r");
    private static final Expectation LF = Expectation.literal("\n");
    private static final Expectation WHITESPACE = Expectation.charClass(" \t\n\r", false);
    private static final Expectation EXPRESSION_CHAR = Expectation.charClass("\n|:{}", true);

    /**
     * Type markers in the order they are tried.
     */
    private static final List<Marker> MARKERS = List.of(
            new Marker("stopping:", DirectiveKind.STOPPING),
            new Marker("~", DirectiveKind.SHUFFLE),
            new Marker("shuffle:", DirectiveKind.SHUFFLE),
            new Marker("&", DirectiveKind.CYCLE),
            new Marker("cycle:", DirectiveKind.CYCLE),
            new Marker("!", DirectiveKind.ONCE_ONLY),
            new Marker("once:", DirectiveKind.ONCE_ONLY)
    );

    private record Marker(String token, DirectiveKind kind) {
        Expectation expectation() {
            return Expectation.literal(token);
        }
    }

    /**
     * Character classes of the three text contexts. Each excludes the characters that
     * terminate a run of text in that context.
     */
    enum TextContext {
        TOP("{}"),
        INLINE("{}|\r\n"),
        MULTI_LINE("{}-");

        private final String excluded;
        private final Expectation expectation;

        TextContext(String excluded) {
            this.excluded = excluded;
            this.expectation = Expectation.charClass(excluded, true);
        }

        boolean accepts(char c) {
            return excluded.indexOf(c) < 0;
        }
    }

    private record Condition(String expression, SourceSpan span) {}

    /** Outcome of one embed rule at one offset: the directive and its end, or null on failure. */
    private record Attempt(Directive directive, int end) {}

    private final IdentityNamer identityNamer;
    private final int maxDepth;

    public EmbedParser() {
        this(IdentityNamer.byOffset(), DEFAULT_MAX_DEPTH);
    }

    public EmbedParser(IdentityNamer identityNamer, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        this.identityNamer = identityNamer;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses a whole source string.
     *
     * @param source     authored text
     * @param documentId identity of the enclosing document, folded into every directive identity
     * @return the parsed document
     * @throws TextSyntaxException if the text is malformed or nests directives too deeply
     */
    public ParsedDocument parse(String source, String documentId) {
        var run = new Run(source, documentId);
        List<ParsedNode> nodes = run.parseDocument();
        log.debug("Parsed document {}: {} chars, {} top-level nodes", documentId, source.length(), nodes.size());
        return new ParsedDocument(documentId, source, nodes);
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Mutable state of a single parse call.
     */
    private final class Run {

        private final String input;
        private final String documentId;
        private final LineIndex lines;
        private int pos;
        private int depth;
        private int maxFailPos;
        private final List<Expectation> maxFailExpected = new ArrayList<>();
        private final Map<Integer, Attempt> inlineAttempts = new HashMap<>();
        private final Map<Integer, Attempt> multiLineAttempts = new HashMap<>();

        Run(String input, String documentId) {
            this.input = input;
            this.documentId = documentId;
            this.lines = new LineIndex(input);
        }

        List<ParsedNode> parseDocument() {
            List<ParsedNode> nodes = parseSequence(TextContext.TOP);
            if (pos == input.length()) {
                return nodes;
            }
            fail(Expectation.end());
            String found = maxFailPos < input.length() ? String.valueOf(input.charAt(maxFailPos)) : null;
            int end = maxFailPos < input.length() ? maxFailPos + 1 : maxFailPos;
            throw TextSyntaxException.of(maxFailExpected, found, lines.span(maxFailPos, end));
        }

        private void fail(Expectation expectation) {
            if (pos < maxFailPos) {
                return;
            }
            if (pos > maxFailPos) {
                maxFailPos = pos;
                maxFailExpected.clear();
            }
            maxFailExpected.add(expectation);
        }

        private boolean literal(String token, Expectation expectation) {
            if (input.startsWith(token, pos)) {
                pos += token.length();
                return true;
            }
            fail(expectation);
            return false;
        }

        private boolean literal(char c, Expectation expectation) {
            if (pos < input.length() && input.charAt(pos) == c) {
                pos++;
                return true;
            }
            fail(expectation);
            return false;
        }

        /** (Text | Embed)* in the given text context. Never fails. */
        private List<ParsedNode> parseSequence(TextContext context) {
            var nodes = new ArrayList<ParsedNode>();
            while (true) {
                ParsedNode node = parseText(context);
                if (node == null) {
                    node = parseEmbed();
                }
                if (node == null) {
                    return nodes;
                }
                nodes.add(node);
            }
        }

        private TextNode parseText(TextContext context) {
            int start = pos;
            while (pos < input.length() && context.accepts(input.charAt(pos))) {
                pos++;
            }
            fail(context.expectation);
            if (pos == start) {
                return null;
            }
            return new TextNode(input.substring(start, pos), lines.span(start, pos));
        }

        private Directive parseEmbed() {
            Directive directive = attempt(inlineAttempts, this::parseInlineEmbed);
            if (directive == null) {
                directive = attempt(multiLineAttempts, this::parseMultiLineEmbed);
            }
            return directive;
        }

        /**
         * Runs an embed rule at most once per offset. A replay restores the outcome and end position;
         * the expectations of the first attempt are already recorded.
         */
        private Directive attempt(Map<Integer, Attempt> attempts, Supplier<Directive> rule) {
            int start = pos;
            Attempt cached = attempts.get(start);
            if (cached == null) {
                Directive directive = rule.get();
                cached = new Attempt(directive, directive != null ? pos : start);
                attempts.put(start, cached);
            }
            pos = cached.end();
            return cached.directive();
        }

        private Directive parseInlineEmbed() {
            int start = pos;
            if (!literal('{', OPEN_BRACE)) {
                return null;
            }
            enterNesting(start);
            try {
                DirectiveKind marker = null;
                Condition condition = parseCondition();
                if (condition != null) {
                    var word = DirectiveClassifier.markerWord(condition.expression());
                    if (word.isPresent()) {
                        marker = word.get();
                        condition = null;
                    }
                } else {
                    marker = parseType();
                }

                var branches = new ArrayList<Branch>();
                branches.add(parseInlineArgument());
                while (literal('|', PIPE)) {
                    branches.add(parseInlineArgument());
                }

                if (!literal('}', CLOSE_BRACE)) {
                    pos = start;
                    return null;
                }
                return directive(start, EmbedForm.INLINE, marker, condition, branches);
            } finally {
                depth--;
            }
        }

        private Branch parseInlineArgument() {
            int start = pos;
            List<ParsedNode> content = parseSequence(TextContext.INLINE);
            return new Branch(null, null, content, lines.span(start, pos));
        }

        private Directive parseMultiLineEmbed() {
            int start = pos;
            if (!literal('{', OPEN_BRACE)) {
                return null;
            }
            enterNesting(start);
            try {
                DirectiveKind marker = parseType();
                if (!parseNewline()) {
                    pos = start;
                    return null;
                }
                skipWhitespace();
                var branches = new ArrayList<Branch>();
                while (literal('-', DASH)) {
                    skipWhitespace();
                    branches.add(parseMultiLineArgument());
                    skipWhitespace();
                }
                if (branches.isEmpty() || !literal('}', CLOSE_BRACE)) {
                    pos = start;
                    return null;
                }
                return directive(start, EmbedForm.MULTI_LINE, marker, null, branches);
            } finally {
                depth--;
            }
        }

        private Branch parseMultiLineArgument() {
            int start = pos;
            Condition condition = parseCondition();
            List<ParsedNode> content = trim(parseSequence(TextContext.MULTI_LINE));
            return new Branch(
                    condition != null ? condition.expression() : null,
                    condition != null ? condition.span() : null,
                    content,
                    lines.span(start, pos));
        }

        private DirectiveKind parseType() {
            for (Marker marker : MARKERS) {
                if (literal(marker.token(), marker.expectation())) {
                    return marker.kind();
                }
            }
            return null;
        }

        private Condition parseCondition() {
            int start = pos;
            while (pos < input.length() && EXPRESSION_CHARS.indexOf(input.charAt(pos)) < 0) {
                pos++;
            }
            fail(EXPRESSION_CHAR);
            if (pos == start) {
                return null;
            }
            int end = pos;
            if (!literal(':', COLON)) {
                pos = start;
                return null;
            }
            skipWhitespace();
            return new Condition(input.substring(start, end), lines.span(start, end));
        }

        private boolean parseNewline() {
            int start = pos;
            literal('\r', CR);
            if (literal('\n', LF)) {
                return true;
            }
            pos = start;
            return false;
        }

        private void skipWhitespace() {
            while (pos < input.length() && isWhitespace(input.charAt(pos))) {
                pos++;
            }
            fail(WHITESPACE);
        }

        private void enterNesting(int bracePos) {
            if (++depth > maxDepth) {
                depth--;
                var span = lines.span(bracePos, bracePos + 1);
                throw new TextSyntaxException(
                        "Directive nesting exceeds the maximum depth of " + maxDepth + " at " + span.start(),
                        span,
                        List.of(Expectation.other("directive nesting depth of at most " + maxDepth)),
                        "{");
            }
        }

        private Directive directive(int start, EmbedForm form, DirectiveKind marker,
                                    Condition condition, List<Branch> branches) {
            SourceSpan span = lines.span(start, pos);
            String guard = condition != null ? condition.expression() : null;
            return new Directive(
                    identityNamer.name(documentId, span),
                    DirectiveClassifier.classify(marker, guard),
                    form,
                    guard,
                    condition != null ? condition.span() : null,
                    branches,
                    span);
        }

        /**
         * Strips surrounding whitespace from multi-line branch content: leading whitespace of the
         * first text node and trailing whitespace of the last one.
         */
        private List<ParsedNode> trim(List<ParsedNode> content) {
            var result = new ArrayList<>(content);
            if (!result.isEmpty() && result.get(0) instanceof TextNode first) {
                String stripped = first.text().stripLeading();
                int startOffset = first.span().end().offset() - stripped.length();
                replaceOrDrop(result, 0, stripped, startOffset, first.span().end().offset());
            }
            if (!result.isEmpty() && result.get(result.size() - 1) instanceof TextNode last) {
                String stripped = last.text().stripTrailing();
                int startOffset = last.span().start().offset();
                replaceOrDrop(result, result.size() - 1, stripped, startOffset, startOffset + stripped.length());
            }
            return result;
        }

        private void replaceOrDrop(List<ParsedNode> nodes, int index, String text, int start, int end) {
            if (text.isEmpty()) {
                nodes.remove(index);
            } else {
                nodes.set(index, new TextNode(text, lines.span(start, end)));
            }
        }
    }

    private static final String EXPRESSION_CHARS = "\n|:{}";

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }
}
