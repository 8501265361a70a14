package com.storyline.core.localization;

/**
 * When a {@link LocalizationProvider} is consulted during resolution.
 */
public enum LocalizationStage {
    /** The raw source is treated as a key and replaced before parsing. */
    BEFORE_PARSE,
    /** The resolved string is treated as a key and replaced after composition. */
    AFTER_COMPOSE
}
