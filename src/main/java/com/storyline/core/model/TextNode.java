package com.storyline.core.model;

/**
 * Literal text that resolves to itself.
 */
public record TextNode(String text, SourceSpan span) implements ParsedNode {
}
