package com.wavesmith.core.executor;

import com.wavesmith.core.model.ModelTier;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One create capability per model tier.
 */
public record TieredCreator(CreateArtifactFn small, CreateArtifactFn medium, CreateArtifactFn large) {

    public TieredCreator {
        Objects.requireNonNull(small, "small");
        Objects.requireNonNull(medium, "medium");
        Objects.requireNonNull(large, "large");
    }

    /** Uses the same capability for every tier. */
    public static TieredCreator uniform(CreateArtifactFn fn) {
        return new TieredCreator(fn, fn, fn);
    }

    public CreateArtifactFn forTier(ModelTier tier) {
        return switch (tier) {
            case SMALL -> small;
            case MEDIUM -> medium;
            case LARGE -> large;
        };
    }

    /** Applies {@code decorator} to each tier's capability. */
    public TieredCreator map(UnaryOperator<CreateArtifactFn> decorator) {
        return new TieredCreator(decorator.apply(small), decorator.apply(medium), decorator.apply(large));
    }
}
