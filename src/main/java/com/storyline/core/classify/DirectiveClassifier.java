package com.storyline.core.classify;

import com.storyline.core.model.Directive;
import com.storyline.core.model.DirectiveKind;

import java.util.Map;
import java.util.Optional;

/**
 * Decides the {@link DirectiveKind} of a parsed embed and checks branch-count contracts.
 * <p>
 * Classification happens at parse time and is purely syntactic. Validation is deferred to the
 * first resolution of a directive so that the grammar never raises definition errors.
 */
public final class DirectiveClassifier {

    /**
     * Word forms of the sequence-type markers, without the trailing colon.
     */
    private static final Map<String, DirectiveKind> MARKER_WORDS = Map.of(
            "stopping", DirectiveKind.STOPPING,
            "shuffle", DirectiveKind.SHUFFLE,
            "cycle", DirectiveKind.CYCLE,
            "once", DirectiveKind.ONCE_ONLY
    );

    private DirectiveClassifier() {} // utility class

    /**
     * Kind of an embed from its optional type marker and optional condition.
     * A condition without a marker makes a conditional; neither makes a stopping list.
     *
     * @param marker    list kind named by the type marker, or null
     * @param condition guard text captured before the colon, or null
     */
    public static DirectiveKind classify(DirectiveKind marker, String condition) {
        if (marker != null) {
            if (!marker.isList()) {
                throw new IllegalArgumentException("Type marker must name a list kind: " + marker);
            }
            return marker;
        }
        return condition != null ? DirectiveKind.CONDITIONAL : DirectiveKind.STOPPING;
    }

    /**
     * Returns the list kind when a captured condition is really a word-form type marker,
     * e.g. the {@code shuffle} in {@code {shuffle: a|b}}.
     */
    public static Optional<DirectiveKind> markerWord(String condition) {
        if (condition == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(MARKER_WORDS.get(condition.strip()));
    }

    /**
     * Checks the branch-count contract of a directive.
     *
     * @throws DefinitionException when a conditional does not have 1 or 2 branches or lacks a guard,
     *                             or when a list directive has no branches
     */
    public static void validate(Directive directive) {
        int count = directive.branches().size();
        if (directive.kind() == DirectiveKind.CONDITIONAL) {
            if (directive.guard() == null) {
                throw new DefinitionException("Conditional directive has no guard",
                        directive.identity(), directive.kind(), directive.span());
            }
            if (count < 1 || count > 2) {
                throw new DefinitionException("Conditional directive must have 1 or 2 branches but has " + count,
                        directive.identity(), directive.kind(), directive.span());
            }
        } else if (count == 0) {
            throw new DefinitionException(directive.kind() + " directive has no branches",
                    directive.identity(), directive.kind(), directive.span());
        }
    }
}
