package com.storyline.core.localization;

import java.util.Map;
import java.util.Optional;

/**
 * Host string table consulted by key. Table loading and management belong to the host.
 */
@FunctionalInterface
public interface LocalizationProvider {

    /**
     * @return the localized text for a key, or empty to keep the text as it is
     */
    Optional<String> lookup(String key);

    static LocalizationProvider of(Map<String, String> table) {
        var copy = Map.copyOf(table);
        return key -> Optional.ofNullable(copy.get(key));
    }
}
