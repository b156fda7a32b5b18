package com.contextkit.core.prompt.model;

/**
 * Coarse complexity tier of an interaction, supplied by the caller.
 */
public enum SceneType {
    SIMPLE,    // click, greeting: no long-term memory lookup
    MEDIUM,
    COMPLEX;

    public boolean isLowestTier() {
        return this == SIMPLE;
    }
}
