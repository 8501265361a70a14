package com.storyline.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Storyline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String DOCUMENT_ID = "documentId";
    public static final String DIRECTIVE_ID = "directiveId";

    private MdcContext() {}

    public static void setDocument(String documentId) {
        MDC.put(DOCUMENT_ID, documentId);
    }

    /**
     * Marks the directive currently being resolved.
     *
     * @return the directive identity that was current before, or null; pass it to
     *         {@link #restoreDirective(String)} when leaving nested directives
     */
    public static String enterDirective(String identity) {
        String previous = MDC.get(DIRECTIVE_ID);
        MDC.put(DIRECTIVE_ID, identity);
        return previous;
    }

    public static void restoreDirective(String previous) {
        if (previous == null) {
            MDC.remove(DIRECTIVE_ID);
        } else {
            MDC.put(DIRECTIVE_ID, previous);
        }
    }

    public static void clear() {
        MDC.remove(DOCUMENT_ID);
        MDC.remove(DIRECTIVE_ID);
    }
}
