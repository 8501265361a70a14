package com.storyline.core.model;

/**
 * One fragment of parsed narrative text: either literal {@link TextNode text} or a
 * {@link Directive}. Sequences of nodes are kept in document order.
 */
public sealed interface ParsedNode permits TextNode, Directive {

    SourceSpan span();
}
