package com.wavesmith.core.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A unit of planned work in an {@link ArtifactGraph}.
 *
 * <p>{@code requires} is kept sorted so that two specs with the same fields
 * always fingerprint identically, regardless of how the set was built.
 *
 * @param id           stable identifier, unique within a graph
 * @param description  free text
 * @param contract     free-text interface description used by verification
 * @param producesFile optional output path relative to the project root
 * @param requires     ids of artifacts this one depends on
 * @param domainType   optional tag (e.g. "protocol", "model", "service")
 * @param metadata     opaque caller data
 */
public record ArtifactSpec(
        String id,
        String description,
        String contract,
        String producesFile,
        Set<String> requires,
        String domainType,
        Map<String, Object> metadata
) {

    private static final Set<String> CONTRACT_TYPES = Set.of("protocol", "interface", "schema", "spec", "outline");

    public ArtifactSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Artifact id must not be blank");
        }
        description = description == null ? "" : description;
        contract = contract == null ? "" : contract;
        requires = requires == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(requires));
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(metadata));
        if (requires.contains(id)) {
            throw new CyclicDependencyException(List.of(id, id));
        }
    }

    public static ArtifactSpec of(String id, String description, String... requires) {
        return new ArtifactSpec(id, description, "", null, Set.of(requires), null, Map.of());
    }

    public ArtifactSpec withRequires(Set<String> newRequires) {
        return new ArtifactSpec(id, description, contract, producesFile, newRequires, domainType, metadata);
    }

    /** True when this artifact has no dependencies. */
    @JsonIgnore
    public boolean isLeaf() {
        return requires.isEmpty();
    }

    /**
     * True for artifacts that define an interface other artifacts build against:
     * leaves, or anything tagged as a protocol, interface, schema, spec or outline.
     */
    @JsonIgnore
    public boolean isInterfaceDefinition() {
        return isLeaf() || (domainType != null && CONTRACT_TYPES.contains(domainType));
    }
}
