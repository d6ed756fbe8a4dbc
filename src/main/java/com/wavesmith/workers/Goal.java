package com.wavesmith.workers;

import java.util.Objects;

/**
 * A unit of work handed to the worker pool. The description is the goal text
 * planned into an artifact graph and keys the goal's saved execution.
 */
public record Goal(String id, String description) {

    public Goal {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Goal id must not be blank");
        }
        description = description == null ? id : description;
    }
}
