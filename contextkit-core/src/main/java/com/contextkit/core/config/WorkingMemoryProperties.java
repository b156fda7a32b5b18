package com.contextkit.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "contextkit.working-memory")
@Getter
@Setter
public class WorkingMemoryProperties {
    private int capacity = 50;
}
