package com.storyline.core.state;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-session mapping from directive identity to its {@link SequenceState}.
 * <p>
 * Entries are created lazily and never removed automatically. Implementations need not be
 * thread-safe: a host resolving text from several threads must serialize access per identity.
 */
public interface SequenceStateStore {

    Optional<SequenceState> find(String identity);

    /**
     * Returns the live state for an identity, creating an unvisited one if absent.
     */
    SequenceState getOrCreate(String identity);

    void put(String identity, SequenceState state);

    void remove(String identity);

    Set<String> identities();

    /**
     * Deep copy of every entry, in insertion order, suitable for saving.
     */
    Map<String, SequenceState> snapshot();

    /**
     * Replaces the whole content with copies of the given entries.
     */
    void restore(Map<String, SequenceState> entries);

    void clear();
}
