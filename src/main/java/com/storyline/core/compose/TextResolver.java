package com.storyline.core.compose;

import com.storyline.core.StorylineException;
import com.storyline.core.classify.DefinitionException;
import com.storyline.core.expression.EvaluationException;
import com.storyline.core.expression.VariableContext;
import com.storyline.core.localization.LocalizationStage;
import com.storyline.core.logging.MdcContext;
import com.storyline.core.model.ParsedDocument;
import com.storyline.core.parser.EmbedParser;
import com.storyline.core.parser.TextSyntaxException;
import com.storyline.core.selection.SelectionEngine;
import com.storyline.core.state.SequenceStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for resolving authored text: parse, select and compose in one call.
 * <p>
 * One resolver belongs to one narrative session; its store holds the selection state of every
 * directive the session has visited. Parsed documents can be cached by the caller and resolved
 * repeatedly with {@link #resolve(ParsedDocument, VariableContext)}.
 */
public class TextResolver {

    private static final Logger log = LoggerFactory.getLogger(TextResolver.class);

    private final ResolverOptions options;
    private final EmbedParser parser;
    private final Compositor compositor;

    public TextResolver(ResolverOptions options) {
        this.options = options;
        this.parser = new EmbedParser(options.identityNamer(), options.maxNestingDepth());
        var engine = new SelectionEngine(options.store(), options.evaluator(),
                options.randomSource(), options.metrics());
        this.compositor = new Compositor(engine);
    }

    /**
     * Parses text, applying before-parse localization when configured.
     *
     * @throws TextSyntaxException if the text is malformed
     */
    public ParsedDocument parse(String source, String documentId) {
        try {
            ParsedDocument document = parser.parse(localizeSource(source), documentId);
            if (options.metrics() != null) {
                options.metrics().recordDirectiveCount(document.directives().size());
            }
            return document;
        } catch (TextSyntaxException e) {
            recordError(e);
            throw e;
        }
    }

    public String resolve(String source, String documentId, VariableContext variables) {
        MdcContext.setDocument(documentId);
        try {
            long start = System.nanoTime();
            String result = resolveParsed(parse(source, documentId), variables);
            recordDuration(start);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Resolves an already parsed document against this resolver's session state.
     */
    public String resolve(ParsedDocument document, VariableContext variables) {
        MdcContext.setDocument(document.documentId());
        try {
            long start = System.nanoTime();
            String result = resolveParsed(document, variables);
            recordDuration(start);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    public SequenceStateStore store() {
        return options.store();
    }

    public ResolverOptions options() {
        return options;
    }

    private String resolveParsed(ParsedDocument document, VariableContext variables) {
        try {
            String composed = compositor.compose(document.nodes(), variables);
            log.debug("Resolved document {} to {} chars", document.documentId(), composed.length());
            return localizeResult(composed);
        } catch (DefinitionException | EvaluationException e) {
            recordError(e);
            throw e;
        }
    }

    private String localizeSource(String source) {
        if (options.localization() == null || options.localizationStage() != LocalizationStage.BEFORE_PARSE) {
            return source;
        }
        return options.localization().lookup(source).orElse(source);
    }

    private String localizeResult(String composed) {
        if (options.localization() == null || options.localizationStage() != LocalizationStage.AFTER_COMPOSE) {
            return composed;
        }
        return options.localization().lookup(composed).orElse(composed);
    }

    private void recordDuration(long startNanos) {
        if (options.metrics() != null) {
            options.metrics().recordResolveDuration(System.nanoTime() - startNanos);
        }
    }

    private void recordError(StorylineException e) {
        if (options.metrics() == null) {
            return;
        }
        if (e instanceof TextSyntaxException) {
            options.metrics().recordError("syntax");
        } else if (e instanceof DefinitionException) {
            options.metrics().recordError("definition");
        } else if (e instanceof EvaluationException) {
            options.metrics().recordError("evaluation");
        }
    }
}
