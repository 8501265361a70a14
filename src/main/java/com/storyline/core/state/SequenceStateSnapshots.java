package com.storyline.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON codec for the contents of a {@link SequenceStateStore}, for inclusion in save files.
 * <p>
 * Layout: {@code {"<identity>": {"counter": 2, "order": [2, 0, 1], "cursor": 2}}}, where
 * {@code order} and {@code cursor} only appear for shuffle directives.
 */
public final class SequenceStateSnapshots {

    private static final Logger log = LoggerFactory.getLogger(SequenceStateSnapshots.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();

    private static final TypeReference<LinkedHashMap<String, SequenceState>> LAYOUT = new TypeReference<>() {};

    private SequenceStateSnapshots() {} // utility class

    public static String toJson(SequenceStateStore store) {
        try {
            return MAPPER.writeValueAsString(store.snapshot());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize sequence state", e);
        }
    }

    /**
     * Parses a snapshot.
     *
     * @throws IllegalArgumentException if the JSON is malformed or holds missing states or invalid counters or cursors
     */
    public static Map<String, SequenceState> fromJson(String json) {
        try {
            Map<String, SequenceState> entries = MAPPER.readValue(json, LAYOUT);
            if (entries == null) {
                return new LinkedHashMap<>();
            }
            entries.forEach((identity, state) -> {
                if (state == null) {
                    throw new IllegalArgumentException("Invalid sequence state snapshot: no state for '" + identity + "'");
                }
            });
            return entries;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid sequence state snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public static void write(SequenceStateStore store, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(store), StandardCharsets.UTF_8);
        log.debug("Wrote {} sequence states to {}", store.identities().size(), file);
    }

    /**
     * Reads a snapshot file into a fresh in-memory store.
     */
    public static InMemorySequenceStateStore read(Path file) throws IOException {
        var entries = fromJson(Files.readString(file, StandardCharsets.UTF_8));
        log.debug("Read {} sequence states from {}", entries.size(), file);
        return new InMemorySequenceStateStore(entries);
    }
}
