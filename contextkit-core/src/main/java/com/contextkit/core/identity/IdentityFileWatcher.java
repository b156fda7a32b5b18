package com.contextkit.core.identity;

import com.contextkit.core.config.IdentityProperties;
import com.contextkit.core.prompt.ContextAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;

/**
 * Polls the identity files and hot-reloads them on change.
 */
@Slf4j
@RequiredArgsConstructor
public class IdentityFileWatcher implements SchedulingConfigurer {

    private final FileIdentitySource identitySource;
    private final ContextAssembler contextAssembler;
    private final IdentityProperties properties;

    /**
     * Registers the poll with a fixed delay of {@code contextkit.identity.watch-interval-ms}.
     */
    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        long intervalMs = properties.getWatchIntervalMs();
        if (intervalMs <= 0) {
            throw new IllegalStateException("contextkit.identity.watch-interval-ms must be positive: " + intervalMs);
        }
        taskRegistrar.addFixedDelayTask(this::checkForChanges, Duration.ofMillis(intervalMs));
        log.info("[IDENTITY] Watching identity files | intervalMs={} | hotReload={}",
            intervalMs, properties.isHotReloadEnabled());
    }

    /**
     * A failed reload keeps the previous identity. The recorded modification
     * times are not advanced, so the next poll retries; this also covers a
     * file caught mid-write.
     *
     * @return true when a new identity was activated
     */
    public boolean checkForChanges() {
        if (!properties.isHotReloadEnabled()) {
            return false;
        }
        if (identitySource.isLoaded() && !identitySource.isHotReloadEnabled()) {
            return false;
        }
        if (!identitySource.hasChanged()) {
            return false;
        }

        try {
            identitySource.reload();
        } catch (IdentityLoadException e) {
            log.warn("[IDENTITY] Reload failed, keeping previous identity | error={}", e.getMessage());
            return false;
        }

        contextAssembler.invalidateIdentityCache();
        log.info("[IDENTITY] Identity files changed, reloaded");
        return true;
    }
}
