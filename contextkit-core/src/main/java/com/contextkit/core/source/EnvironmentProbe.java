package com.contextkit.core.source;

import java.util.Optional;

/**
 * One line of the environment fragment, e.g. weather or system status.
 */
public interface EnvironmentProbe {

    String label();

    /**
     * Current reading, empty when nothing is available yet.
     */
    Optional<String> probe();
}
