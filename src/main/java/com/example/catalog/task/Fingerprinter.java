package com.example.catalog.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives fingerprints from (task name, arguments).
 *
 * Arguments are rendered to canonical JSON (keys sorted at every level) so the
 * same logical input always hashes the same way.
 */
public class Fingerprinter {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    public Fingerprint fingerprint(TaskSpec spec, Map<String, ?> arguments) {
        Map<String, Object> normalized = new TreeMap<>();
        arguments.forEach((name, value) -> {
            if (!spec.excludedArguments().contains(name)) {
                normalized.put(name, value);
            }
        });

        String json;
        try {
            json = canonicalMapper.writeValueAsString(normalized);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Arguments of " + spec.name() + " are not serializable", e);
        }

        String digest = Hashing.sha256()
                .hashString(spec.name() + "\n" + json, StandardCharsets.UTF_8)
                .toString();
        return new Fingerprint(spec.name(), digest);
    }
}
