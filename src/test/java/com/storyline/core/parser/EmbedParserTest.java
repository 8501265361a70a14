package com.storyline.core.parser;

import com.storyline.core.model.Branch;
import com.storyline.core.model.Directive;
import com.storyline.core.model.DirectiveKind;
import com.storyline.core.model.EmbedForm;
import com.storyline.core.model.ParsedDocument;
import com.storyline.core.model.ParsedNode;
import com.storyline.core.model.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbedParserTest {

    private final EmbedParser parser = new EmbedParser();

    private ParsedDocument parse(String source) {
        return parser.parse(source, "doc");
    }

    private static Directive onlyDirective(ParsedDocument document) {
        var directives = document.directives();
        assertEquals(1, directives.size(), "expected exactly one directive");
        return directives.get(0);
    }

    private static String text(List<ParsedNode> content) {
        var sb = new StringBuilder();
        for (ParsedNode node : content) {
            assertInstanceOf(TextNode.class, node, "expected plain text content");
            sb.append(((TextNode) node).text());
        }
        return sb.toString();
    }

    @Nested
    @DisplayName("Plain text")
    class PlainText {

        @Test
        @DisplayName("text without braces is a single text node")
        void singleTextNode() {
            var document = parse("The door creaks open: nothing | nobody.");
            assertEquals(1, document.nodes().size());
            var node = assertInstanceOf(TextNode.class, document.nodes().get(0));
            assertEquals("The door creaks open: nothing | nobody.", node.text());
        }

        @Test
        @DisplayName("empty source yields no nodes")
        void emptySource() {
            assertTrue(parse("").nodes().isEmpty());
        }
    }

    @Nested
    @DisplayName("Inline embeds")
    class InlineEmbeds {

        @Test
        @DisplayName("splits surrounding text and pipe-separated branches")
        void surroundingTextAndBranches() {
            var document = parse("Hello {A|B|C}!");
            assertEquals(3, document.nodes().size());
            assertEquals("Hello ", ((TextNode) document.nodes().get(0)).text());
            assertEquals("!", ((TextNode) document.nodes().get(2)).text());

            var directive = assertInstanceOf(Directive.class, document.nodes().get(1));
            assertEquals(DirectiveKind.STOPPING, directive.kind());
            assertEquals(EmbedForm.INLINE, directive.form());
            assertNull(directive.guard());
            assertEquals(List.of("A", "B", "C"), directive.branches().stream().map(b -> text(b.content())).toList());
            assertEquals("doc@6", directive.identity());
            assertEquals(6, directive.span().start().offset());
            assertEquals(13, directive.span().end().offset());
        }

        @Test
        @DisplayName("symbol type markers select the list kind")
        void symbolMarkers() {
            assertEquals(DirectiveKind.SHUFFLE, onlyDirective(parse("{~A|B}")).kind());
            assertEquals(DirectiveKind.CYCLE, onlyDirective(parse("{&A|B}")).kind());
            assertEquals(DirectiveKind.ONCE_ONLY, onlyDirective(parse("{!A|B}")).kind());
        }

        @Test
        @DisplayName("word type markers select the list kind and swallow following whitespace")
        void wordMarkers() {
            var shuffle = onlyDirective(parse("{shuffle: A|B}"));
            assertEquals(DirectiveKind.SHUFFLE, shuffle.kind());
            assertNull(shuffle.guard());
            assertEquals("A", text(shuffle.branch(0).content()));

            assertEquals(DirectiveKind.CYCLE, onlyDirective(parse("{cycle: A|B}")).kind());
            assertEquals(DirectiveKind.ONCE_ONLY, onlyDirective(parse("{once: A}")).kind());
            assertEquals(DirectiveKind.STOPPING, onlyDirective(parse("{stopping: A}")).kind());
        }

        @Test
        @DisplayName("marker words are case-sensitive; other spellings are guards")
        void markerWordsAreCaseSensitive() {
            var directive = onlyDirective(parse("{Shuffle: A|B}"));
            assertEquals(DirectiveKind.CONDITIONAL, directive.kind());
            assertEquals("Shuffle", directive.guard());
        }

        @Test
        @DisplayName("condition text before the colon becomes the guard, verbatim")
        void conditional() {
            var directive = onlyDirective(parse("{x > 0: positive|non-positive}"));
            assertEquals(DirectiveKind.CONDITIONAL, directive.kind());
            assertEquals("x > 0", directive.guard());
            assertEquals(1, directive.guardSpan().start().offset());
            assertEquals(6, directive.guardSpan().end().offset());
            assertEquals(List.of("positive", "non-positive"),
                    directive.branches().stream().map(b -> text(b.content())).toList());
            assertTrue(directive.branches().stream().noneMatch(Branch::hasGuard));
        }

        @Test
        @DisplayName("inline branch content is not trimmed")
        void inlineContentKeepsWhitespace() {
            var directive = onlyDirective(parse("{ A | B }"));
            assertEquals(" A ", text(directive.branch(0).content()));
            assertEquals(" B ", text(directive.branch(1).content()));
        }

        @Test
        @DisplayName("empty arguments are legal")
        void emptyArguments() {
            var empty = onlyDirective(parse("{}"));
            assertEquals(DirectiveKind.STOPPING, empty.kind());
            assertEquals(1, empty.branches().size());
            assertTrue(empty.branch(0).content().isEmpty());

            var trailing = onlyDirective(parse("{a|}"));
            assertEquals(2, trailing.branches().size());
            assertTrue(trailing.branch(1).content().isEmpty());
        }

        @Test
        @DisplayName("nested embeds get their own identity inside the parent span")
        void nestedEmbeds() {
            var document = parse("{A {&x|y}|B}");
            var outer = assertInstanceOf(Directive.class, document.nodes().get(0));
            var content = outer.branch(0).content();
            assertEquals(2, content.size());
            assertEquals("A ", ((TextNode) content.get(0)).text());

            var inner = assertInstanceOf(Directive.class, content.get(1));
            assertEquals(DirectiveKind.CYCLE, inner.kind());
            assertEquals("doc@0", outer.identity());
            assertEquals("doc@3", inner.identity());
            assertTrue(outer.span().contains(inner.span()));
            assertEquals(List.of(outer, inner), document.directives());
        }
    }

    @Nested
    @DisplayName("Multi-line embeds")
    class MultiLineEmbeds {

        @Test
        @DisplayName("dash entries become trimmed branches with optional guards")
        void dashEntries() {
            var directive = onlyDirective(parse("{&\n- First\n- x > 1: Second\n-   Third  \n}"));
            assertEquals(DirectiveKind.CYCLE, directive.kind());
            assertEquals(EmbedForm.MULTI_LINE, directive.form());
            assertNull(directive.guard());
            assertEquals(List.of("First", "Second", "Third"),
                    directive.branches().stream().map(b -> text(b.content())).toList());
            assertFalse(directive.branch(0).hasGuard());
            assertEquals("x > 1", directive.branch(1).guard());
            assertEquals(3, directive.branch(1).guardSpan().start().line());
        }

        @Test
        @DisplayName("without a marker the list is stopping; CRLF line ends are accepted")
        void crlf() {
            var directive = onlyDirective(parse("{\r\n- A\r\n- B\r\n}"));
            assertEquals(DirectiveKind.STOPPING, directive.kind());
            assertEquals(List.of("A", "B"), directive.branches().stream().map(b -> text(b.content())).toList());
        }

        @Test
        @DisplayName("word markers work before the newline")
        void wordMarker() {
            assertEquals(DirectiveKind.SHUFFLE, onlyDirective(parse("{shuffle:\n- A\n- B\n}")).kind());
        }

        @Test
        @DisplayName("deeply nested word-marker lists parse in bounded time")
        void deepWordMarkerNesting() {
            int depth = 40;
            String source = "{cycle:\n- ".repeat(depth) + "x" + "\n}".repeat(depth);

            var document = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> parse(source));

            var directives = document.directives();
            assertEquals(depth, directives.size());
            assertTrue(directives.stream().allMatch(d -> d.kind() == DirectiveKind.CYCLE
                    && d.form() == EmbedForm.MULTI_LINE));
            assertEquals("x", text(directives.get(depth - 1).branch(0).content()));
        }

        @Test
        @DisplayName("branch content may contain inline embeds")
        void nestedInline() {
            var document = parse("{\n- Hi {A|B} there\n- Bye\n}");
            var outer = assertInstanceOf(Directive.class, document.nodes().get(0));
            var content = outer.branch(0).content();
            assertEquals(3, content.size());
            assertEquals("Hi ", ((TextNode) content.get(0)).text());
            assertInstanceOf(Directive.class, content.get(1));
            assertEquals(" there", ((TextNode) content.get(2)).text());
            assertEquals(2, document.directives().size());
        }
    }

    @Nested
    @DisplayName("Spans and identities")
    class SpansAndIdentities {

        @Test
        @DisplayName("positions count lines on newline and columns from 1")
        void linesAndColumns() {
            var directive = onlyDirective(parse("ab\n{A}"));
            assertEquals(3, directive.span().start().offset());
            assertEquals(2, directive.span().start().line());
            assertEquals(1, directive.span().start().column());
            assertEquals(6, directive.span().end().offset());
            assertEquals(4, directive.span().end().column());
        }

        @Test
        @DisplayName("parsing the same source twice yields identical identities")
        void identitiesAreStable() {
            String source = "{A|B} and {~C|D {&E|F}}\n{\n- G\n- H\n}";
            var first = parser.parse(source, "scene-7").directives();
            var second = parser.parse(source, "scene-7").directives();

            assertEquals(4, first.size());
            assertEquals(first.stream().map(Directive::identity).toList(),
                    second.stream().map(Directive::identity).toList());
            assertEquals(first.size(), first.stream().map(Directive::identity).distinct().count());
        }

        @Test
        @DisplayName("custom identity namers are applied to every directive")
        void customNamer() {
            var byLine = new EmbedParser((doc, span) -> doc + ":" + span.start().line() + ":" + span.start().column(),
                    EmbedParser.DEFAULT_MAX_DEPTH);
            var directives = byLine.parse("x {A}\n{B|{C}}", "d").directives();
            assertEquals(List.of("d:1:3", "d:2:1", "d:2:4"), directives.stream().map(Directive::identity).toList());
        }

        @Test
        @DisplayName("document id is part of the identity")
        void documentIdInIdentity() {
            assertNotEquals(parser.parse("{A}", "one").directives().get(0).identity(),
                    parser.parse("{A}", "two").directives().get(0).identity());
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrors {

        @Test
        @DisplayName("missing closing brace is reported at end of input")
        void missingCloseBrace() {
            var e = assertThrows(TextSyntaxException.class, () -> parse("{stopping: A|B"));
            assertEquals(14, e.position().offset());
            assertEquals(1, e.position().line());
            assertEquals(15, e.position().column());
            assertNull(e.found());
            assertEquals(0, e.span().length());
            assertEquals(List.of("\"{\"", "\"|\"", "\"}\"", "[^{}|\\r\\n]"),
                    e.expected().stream().map(Expectation::description).toList());
            assertEquals("Expected \"{\", \"|\", \"}\", or [^{}|\\r\\n] but end of input found.", e.getMessage());
        }

        @Test
        @DisplayName("stray closing brace reports the character found")
        void strayCloseBrace() {
            var e = assertThrows(TextSyntaxException.class, () -> parse("a}b"));
            assertEquals(1, e.position().offset());
            assertEquals("}", e.found());
            assertEquals(1, e.span().length());
            assertEquals("Expected \"{\", [^{}], or end of input but \"}\" found.", e.getMessage());
        }

        @Test
        @DisplayName("line break inside an inline embed is an error at the break")
        void newlineInsideInline() {
            var e = assertThrows(TextSyntaxException.class, () -> parse("{A\nB}"));
            assertEquals(2, e.position().offset());
            assertEquals("\n", e.found());
            assertTrue(e.getMessage().endsWith("but \"\\n\" found."), e.getMessage());
        }

        @Test
        @DisplayName("unterminated multi-line embed is an error")
        void unterminatedMultiLine() {
            assertThrows(TextSyntaxException.class, () -> parse("{\n- A\n- B\n"));
        }

        @Test
        @DisplayName("nesting deeper than the limit fails at the offending brace")
        void nestingDepth() {
            var shallow = new EmbedParser(IdentityNamer.byOffset(), 2);
            var e = assertThrows(TextSyntaxException.class, () -> shallow.parse("{{{a}}}", "doc"));
            assertEquals(2, e.position().offset());
            assertEquals(3, e.position().column());
            assertEquals("{", e.found());
            assertEquals(Expectation.Type.OTHER, e.expected().get(0).type());

            var deepEnough = new EmbedParser(IdentityNamer.byOffset(), 3);
            assertEquals(3, deepEnough.parse("{{{a}}}", "doc").directives().size());
        }

        @Test
        @DisplayName("maximum depth must be positive")
        void invalidDepth() {
            assertThrows(IllegalArgumentException.class, () -> new EmbedParser(IdentityNamer.byOffset(), 0));
        }
    }
}
