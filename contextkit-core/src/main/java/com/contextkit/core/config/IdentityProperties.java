package com.contextkit.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Location of identity.json / system_prompt.txt and hot reload settings.
 */
@ConfigurationProperties(prefix = "contextkit.identity")
@Getter
@Setter
public class IdentityProperties {
    private Path configDir = Path.of("./config");
    private boolean hotReloadEnabled = true;
    private long watchIntervalMs = 1000;
}
