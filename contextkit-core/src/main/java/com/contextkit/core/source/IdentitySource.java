package com.contextkit.core.source;

/**
 * Layer 1: character settings and user profile.
 */
public interface IdentitySource {

    String getContext();
}
