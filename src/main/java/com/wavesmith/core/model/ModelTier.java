package com.wavesmith.core.model;

/**
 * Cost/capability bucket of the content-generation capability.
 */
public enum ModelTier {
    SMALL,
    MEDIUM,
    LARGE
}
