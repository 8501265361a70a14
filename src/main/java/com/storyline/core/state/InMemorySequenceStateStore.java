package com.storyline.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default {@link SequenceStateStore} backed by an insertion-ordered map. Not synchronized.
 */
public class InMemorySequenceStateStore implements SequenceStateStore {

    private final Map<String, SequenceState> states = new LinkedHashMap<>();

    public InMemorySequenceStateStore() {
    }

    public InMemorySequenceStateStore(Map<String, SequenceState> initial) {
        restore(initial);
    }

    @Override
    public Optional<SequenceState> find(String identity) {
        return Optional.ofNullable(states.get(identity));
    }

    @Override
    public SequenceState getOrCreate(String identity) {
        return states.computeIfAbsent(identity, k -> new SequenceState());
    }

    @Override
    public void put(String identity, SequenceState state) {
        states.put(identity, state);
    }

    @Override
    public void remove(String identity) {
        states.remove(identity);
    }

    @Override
    public Set<String> identities() {
        return Collections.unmodifiableSet(states.keySet());
    }

    @Override
    public Map<String, SequenceState> snapshot() {
        var copy = new LinkedHashMap<String, SequenceState>();
        states.forEach((identity, state) -> copy.put(identity, state.copy()));
        return copy;
    }

    @Override
    public void restore(Map<String, SequenceState> entries) {
        states.clear();
        entries.forEach((identity, state) -> states.put(identity, state.copy()));
    }

    @Override
    public void clear() {
        states.clear();
    }

    public int size() {
        return states.size();
    }
}
