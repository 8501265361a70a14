package com.storyline.core.model;

import java.util.List;

/**
 * An authored {@code {...}} annotation that expands to computed text at resolution time.
 *
 * @param identity  stable key for persisted selection state, derived from the span and document id
 * @param kind      selection discipline
 * @param form      inline or multi-line authoring form
 * @param guard     condition expression of a {@link DirectiveKind#CONDITIONAL} directive, otherwise null
 * @param guardSpan span of {@code guard}, null when absent
 * @param branches  branches in authoring order; never reordered
 * @param span      span of the directive from the opening to the closing brace
 */
public record Directive(
    String identity,
    DirectiveKind kind,
    EmbedForm form,
    String guard,
    SourceSpan guardSpan,
    List<Branch> branches,
    SourceSpan span
) implements ParsedNode {

    public Directive {
        branches = List.copyOf(branches);
    }

    public Branch branch(int index) {
        return branches.get(index);
    }
}
