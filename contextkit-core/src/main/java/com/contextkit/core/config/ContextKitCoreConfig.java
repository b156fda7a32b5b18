package com.contextkit.core.config;

import com.contextkit.core.cache.CacheSweepScheduler;
import com.contextkit.core.environment.EnvironmentContextProvider;
import com.contextkit.core.environment.SystemLoadProbe;
import com.contextkit.core.identity.FileIdentitySource;
import com.contextkit.core.identity.IdentityFileWatcher;
import com.contextkit.core.prompt.ContextAssembler;
import com.contextkit.core.source.EnvironmentProbe;
import com.contextkit.core.source.FactsSource;
import com.contextkit.core.source.MemoryVolumeSource;
import com.contextkit.core.source.RetrievalSource;
import com.contextkit.core.working.InMemoryWorkingState;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the prompt builder and its default collaborators.
 *
 * Retrieval, facts and memory-volume sources are optional: the host contributes
 * them as beans when it has a long-term memory store.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({
    PromptBuilderProperties.class,
    IdentityProperties.class,
    WorkingMemoryProperties.class
})
@Slf4j
public class ContextKitCoreConfig {

    @Bean
    public Clock contextKitClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SystemLoadProbe systemLoadProbe() {
        return new SystemLoadProbe();
    }

    @Bean
    public EnvironmentContextProvider environmentContextProvider(Clock contextKitClock, List<EnvironmentProbe> probes) {
        log.info("Environment probes registered: {}",
            probes.stream().map(EnvironmentProbe::label).collect(Collectors.joining(", ")));
        return new EnvironmentContextProvider(contextKitClock, probes);
    }

    /**
     * Loads identity.json and system_prompt.txt eagerly; a missing or broken
     * identity fails startup.
     */
    @Bean
    public FileIdentitySource fileIdentitySource(IdentityProperties identityProperties, ObjectProvider<ObjectMapper> objectMapper) {
        FileIdentitySource source = new FileIdentitySource(
            identityProperties.getConfigDir(),
            objectMapper.getIfAvailable(ObjectMapper::new));
        source.reload();
        return source;
    }

    @Bean
    public InMemoryWorkingState inMemoryWorkingState(WorkingMemoryProperties workingMemoryProperties) {
        return new InMemoryWorkingState(workingMemoryProperties.getCapacity());
    }

    @Bean
    public ContextAssembler contextAssembler(
            PromptBuilderProperties promptBuilderProperties,
            Clock contextKitClock,
            FileIdentitySource fileIdentitySource,
            InMemoryWorkingState inMemoryWorkingState,
            EnvironmentContextProvider environmentContextProvider,
            ObjectProvider<RetrievalSource> retrievalSource,
            ObjectProvider<FactsSource> factsSource,
            ObjectProvider<MemoryVolumeSource> memoryVolumeSource) {

        ContextAssembler assembler = ContextAssembler.builder()
            .properties(promptBuilderProperties)
            .clock(contextKitClock)
            .identitySource(fileIdentitySource)
            .workingStateSource(inMemoryWorkingState)
            .environmentProvider(environmentContextProvider)
            .retrievalSource(retrievalSource.getIfAvailable())
            .factsSource(factsSource.getIfAvailable())
            .memoryVolumeSource(memoryVolumeSource.getIfAvailable())
            .build();

        log.info("ContextAssembler initialized | mode={} | autoAdjust={} | cache={} | retrieval={} | facts={}",
            promptBuilderProperties.getMode(),
            promptBuilderProperties.isAutoAdjustMode(),
            promptBuilderProperties.isEnableCache(),
            retrievalSource.getIfAvailable() != null,
            factsSource.getIfAvailable() != null);
        return assembler;
    }

    @Bean
    public IdentityFileWatcher identityFileWatcher(
            FileIdentitySource fileIdentitySource,
            ContextAssembler contextAssembler,
            IdentityProperties identityProperties) {
        return new IdentityFileWatcher(fileIdentitySource, contextAssembler, identityProperties);
    }

    @Bean
    public CacheSweepScheduler cacheSweepScheduler(ContextAssembler contextAssembler) {
        return new CacheSweepScheduler(contextAssembler);
    }
}
