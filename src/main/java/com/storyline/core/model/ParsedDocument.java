package com.storyline.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The immutable result of one parse call.
 *
 * @param documentId identity of the enclosing document, part of every directive identity
 * @param source     the text that was parsed
 * @param nodes      top-level nodes in document order
 */
public record ParsedDocument(String documentId, String source, List<ParsedNode> nodes) {

    public ParsedDocument {
        nodes = List.copyOf(nodes);
    }

    /**
     * All directives of the document, nested ones included, in pre-order.
     */
    public List<Directive> directives() {
        var result = new ArrayList<Directive>();
        collect(nodes, result);
        return result;
    }

    private static void collect(List<ParsedNode> nodes, List<Directive> into) {
        for (ParsedNode node : nodes) {
            if (node instanceof Directive directive) {
                into.add(directive);
                for (Branch branch : directive.branches()) {
                    collect(branch.content(), into);
                }
            }
        }
    }
}
