package com.storyline.core.compose;

import com.storyline.core.expression.VariableContext;
import com.storyline.core.logging.MdcContext;
import com.storyline.core.model.Directive;
import com.storyline.core.model.ParsedNode;
import com.storyline.core.model.TextNode;
import com.storyline.core.selection.SelectionEngine;

import java.util.List;
import java.util.OptionalInt;

/**
 * Walks a node sequence and concatenates its resolved text.
 * <p>
 * Text nodes resolve to themselves. A directive resolves to the content of the branch the
 * {@link SelectionEngine} picks, composed recursively, so nested directives are selected with
 * their own identity and state. Multi-line branch content arrives already trimmed from the parser.
 */
public class Compositor {

    private final SelectionEngine selectionEngine;

    public Compositor(SelectionEngine selectionEngine) {
        this.selectionEngine = selectionEngine;
    }

    public String compose(List<ParsedNode> nodes, VariableContext context) {
        var out = new StringBuilder();
        appendNodes(nodes, context, out);
        return out.toString();
    }

    private void appendNodes(List<ParsedNode> nodes, VariableContext context, StringBuilder out) {
        for (ParsedNode node : nodes) {
            if (node instanceof TextNode text) {
                out.append(text.text());
            } else if (node instanceof Directive directive) {
                appendDirective(directive, context, out);
            }
        }
    }

    private void appendDirective(Directive directive, VariableContext context, StringBuilder out) {
        String previous = MdcContext.enterDirective(directive.identity());
        try {
            OptionalInt chosen = selectionEngine.select(directive, context);
            if (chosen.isPresent()) {
                appendNodes(directive.branch(chosen.getAsInt()).content(), context, out);
            }
        } finally {
            MdcContext.restoreDirective(previous);
        }
    }
}
