package com.wavesmith.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * SHA-256 helpers for content, specs and goals.
 *
 * <p>Spec fingerprints are computed over canonical JSON (properties and map
 * keys sorted) so that they depend only on the declared fields.
 */
public final class ContentHasher {

    public static final int GOAL_HASH_LENGTH = 16;

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private ContentHasher() {}

    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** First 16 hex characters of the SHA-256 of the goal text. */
    public static String goalHash(String goal) {
        return sha256(goal).substring(0, GOAL_HASH_LENGTH);
    }

    /** Hash of the artifact's own declared fields, excluding its dependencies' state. */
    public static String fingerprint(ArtifactSpec spec) {
        try {
            return sha256(CANONICAL.writeValueAsString(spec));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot fingerprint artifact '%s'".formatted(spec.id()), e);
        }
    }

    /**
     * Input hash of every artifact: its own fingerprint combined with the input
     * hashes of its dependencies, so a change anywhere upstream changes every
     * hash below it.
     */
    public static Map<String, String> inputHashes(ArtifactGraph graph) {
        Map<String, String> hashes = new HashMap<>();
        for (String id : graph.topologicalOrder()) {
            ArtifactSpec spec = graph.get(id);
            var sb = new StringBuilder(fingerprint(spec));
            for (String req : spec.requires()) {
                sb.append('\n').append(req).append('=').append(hashes.get(req));
            }
            hashes.put(id, sha256(sb.toString()));
        }
        return hashes;
    }
}
