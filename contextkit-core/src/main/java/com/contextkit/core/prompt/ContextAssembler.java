package com.contextkit.core.prompt;

import com.contextkit.common.constants.ContextKeys;
import com.contextkit.core.budget.BudgetEnforcer;
import com.contextkit.core.budget.BudgetPolicy;
import com.contextkit.core.budget.BudgetProfile;
import com.contextkit.core.cache.CacheStats;
import com.contextkit.core.cache.TieredCache;
import com.contextkit.core.config.PromptBuilderProperties;
import com.contextkit.core.environment.EnvironmentContextProvider;
import com.contextkit.core.prompt.model.AssembledPrompt;
import com.contextkit.core.prompt.model.InteractionRequest;
import com.contextkit.core.prompt.model.RetrievalQuery;
import com.contextkit.core.prompt.model.SceneType;
import com.contextkit.core.source.FactsSource;
import com.contextkit.core.source.IdentitySource;
import com.contextkit.core.source.MemoryVolumeSource;
import com.contextkit.core.source.RetrievalSource;
import com.contextkit.core.source.WorkingStateSource;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Incremental prompt builder.
 *
 * <p>Each build runs six strictly ordered steps:
 * <ol>
 *   <li>static layer: identity, cached until invalidated</li>
 *   <li>semi-static layer: facts summary, cached with a medium ttl</li>
 *   <li>dynamic layer: conversation, live state and environment, never cached</li>
 *   <li>retrieval layer: long-term memories, skipped for simple scenes, cached briefly</li>
 *   <li>assembly in a fixed section order</li>
 *   <li>budget check and proportional truncation</li>
 * </ol>
 *
 * <p>The builder owns its {@link TieredCache}; collaborators are supplied at
 * construction. Missing identity or working-state sources make every build fail.
 * Facts, retrieval and environment data degrade to placeholders when unavailable.
 */
@Slf4j
public class ContextAssembler {

    private final PromptBuilderProperties properties;
    private final TieredCache cache;
    private final BudgetPolicy budgetPolicy;
    private final BudgetEnforcer budgetEnforcer;
    private final IdentitySource identitySource;
    private final WorkingStateSource workingStateSource;
    private final RetrievalSource retrievalSource;
    private final FactsSource factsSource;
    private final MemoryVolumeSource memoryVolumeSource;
    private final EnvironmentContextProvider environmentProvider;
    private final AtomicLong buildCounter = new AtomicLong();

    // Bumped by every invalidation of a partition; a build only stores what it
    // loaded if no invalidation happened while it was loading.
    private final Object invalidationLock = new Object();
    private long staticGeneration;
    private long semiStaticGeneration;

    @Builder
    public ContextAssembler(
            PromptBuilderProperties properties,
            Clock clock,
            IdentitySource identitySource,
            WorkingStateSource workingStateSource,
            RetrievalSource retrievalSource,
            FactsSource factsSource,
            MemoryVolumeSource memoryVolumeSource,
            EnvironmentContextProvider environmentProvider) {
        Clock effectiveClock = clock != null ? clock : Clock.systemDefaultZone();
        this.properties = properties != null ? properties : new PromptBuilderProperties();
        this.cache = new TieredCache(effectiveClock);
        this.budgetPolicy = new BudgetPolicy(this.properties);
        this.budgetEnforcer = new BudgetEnforcer(this.properties);
        this.identitySource = identitySource;
        this.workingStateSource = workingStateSource;
        this.retrievalSource = retrievalSource;
        this.factsSource = factsSource;
        this.memoryVolumeSource = memoryVolumeSource;
        this.environmentProvider = environmentProvider != null
            ? environmentProvider
            : new EnvironmentContextProvider(effectiveClock, List.of());
    }

    /**
     * Build the prompt text for one interaction.
     *
     * @throws PromptAssemblyException when a required source is missing
     */
    public String build(SceneType sceneType, InteractionRequest request, List<String> memoryHints) {
        return assemble(sceneType, request, memoryHints).getText();
    }

    /**
     * Build the prompt and report how it was sized.
     *
     * @throws PromptAssemblyException when a required source is missing
     */
    public AssembledPrompt assemble(SceneType sceneType, InteractionRequest request, List<String> memoryHints) {
        String buildId = "build-" + buildCounter.incrementAndGet();
        long startTime = System.currentTimeMillis();

        if (identitySource == null) {
            log.error("[PROMPT_BUILDER] Identity source not configured | buildId={}", buildId);
            throw new PromptAssemblyException("Identity source not initialized");
        }
        if (workingStateSource == null) {
            log.error("[PROMPT_BUILDER] Working state source not configured | buildId={}", buildId);
            throw new PromptAssemblyException("Working state source not initialized");
        }

        InteractionRequest interaction = request != null
            ? request
            : InteractionRequest.builder().interactionType("").build();
        SceneType scene = sceneType != null ? sceneType : SceneType.MEDIUM;

        log.debug("[PROMPT_BUILDER] Starting build | buildId={} | scene={} | interactionType={} | hints={}",
            buildId, scene, interaction.getInteractionType(), memoryHints);

        try {
            // Step 1: static layer
            String identityContext = loadStaticContext();

            // Step 2: semi-static layer
            String factsSummary = loadSemiStaticContext();

            // Step 3: dynamic layer, always fresh
            String workingContext = refreshDynamicContext();

            // Step 4: retrieval layer
            boolean retrievalSkipped = scene.isLowestTier();
            String memoryContext = retrieveMemories(scene, interaction, memoryHints);

            // Step 5: assembly
            String prompt = assemblePrompt(identityContext, workingContext, factsSummary, memoryContext, interaction);

            // Step 6: budget
            BudgetProfile profile = resolveProfile();
            BudgetEnforcer.BudgetCheck check = budgetEnforcer.enforce(prompt, budgetPolicy.budgetFor(profile));

            long duration = System.currentTimeMillis() - startTime;
            log.info("[PROMPT_BUILDER] Prompt assembled | buildId={} | scene={} | profile={} | estimatedSize={} | available={} | truncated={} | length={} | durationMs={}",
                buildId, scene, profile, check.estimatedSize(), check.available(), check.truncated(),
                check.text().length(), duration);

            return AssembledPrompt.builder()
                .text(check.text())
                .profile(profile)
                .estimatedSize(check.estimatedSize())
                .availableBudget(check.available())
                .truncated(check.truncated())
                .retrievalSkipped(retrievalSkipped)
                .durationMs(duration)
                .build();
        } catch (PromptAssemblyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[PROMPT_BUILDER] Build failed | buildId={} | durationMs={} | error={}",
                buildId, System.currentTimeMillis() - startTime, e.getMessage(), e);
            throw new PromptAssemblyException("Failed to build prompt", e);
        }
    }

    // ========== Pipeline steps ==========

    private String loadStaticContext() {
        Optional<String> cached = cache.getStatic(ContextKeys.IDENTITY);
        if (cached.isPresent()) {
            return cached.get();
        }

        long generation = currentStaticGeneration();
        String identityContext = identitySource.getContext();
        if (identityContext == null) {
            identityContext = "";
        }

        boolean stored;
        synchronized (invalidationLock) {
            stored = generation == staticGeneration;
            if (stored) {
                cache.setStatic(ContextKeys.IDENTITY, identityContext, properties.getStaticCacheTtl());
            }
        }
        if (stored) {
            log.debug("[PROMPT_BUILDER] Identity loaded into static cache | length={}", identityContext.length());
        } else {
            log.debug("[PROMPT_BUILDER] Identity invalidated during load, not cached");
        }
        return identityContext;
    }

    private String loadSemiStaticContext() {
        Optional<String> cached = cache.getSemiStatic(ContextKeys.FACTS_SUMMARY);
        if (cached.isPresent()) {
            return cached.get();
        }

        long generation = currentSemiStaticGeneration();
        List<String> preferences = List.of();
        List<String> patterns = List.of();
        if (factsSource != null) {
            try {
                preferences = nullToEmpty(factsSource.getPreferences());
                patterns = nullToEmpty(factsSource.getBehaviorPatterns());
            } catch (RuntimeException e) {
                // Not cached, so the next build retries the source
                log.warn("[PROMPT_BUILDER] Facts source failed, using placeholder | error={}", e.getMessage());
                return PromptSections.NO_FACTS;
            }
        }

        String summary = summarizeFacts(preferences, patterns);
        synchronized (invalidationLock) {
            if (generation == semiStaticGeneration) {
                cache.setSemiStatic(ContextKeys.FACTS_SUMMARY, summary, properties.getSemiStaticCacheTtl());
            }
        }
        return summary;
    }

    private String refreshDynamicContext() {
        List<String> conversations = nullToEmpty(
            workingStateSource.getRecentConversations(properties.getRecentConversationLimit()));
        String realtimeState = workingStateSource.getStateSnapshot();
        String environment = environmentProvider.describe();

        List<String> parts = new ArrayList<>();
        parts.add(PromptSections.WORKING_MEMORY_HEADER);

        if (!conversations.isEmpty()) {
            parts.add(PromptSections.CONVERSATION_HISTORY);
            for (String turn : conversations) {
                parts.add("- " + turn);
            }
        }

        parts.add(PromptSections.REALTIME_STATE + "\n" + (realtimeState == null ? "" : realtimeState));
        parts.add(PromptSections.ENVIRONMENT + "\n" + environment);

        return String.join("\n", parts);
    }

    private String retrieveMemories(SceneType scene, InteractionRequest interaction, List<String> memoryHints) {
        if (scene.isLowestTier()) {
            return "";
        }

        List<String> keywords = nullToEmpty(memoryHints);
        String eventType = interaction.getInteractionType();
        String joinedKeywords = String.join(ContextKeys.KEYWORD_SEPARATOR, keywords);

        if (properties.isEnableCache()) {
            Optional<String> cached = cache.getRetrieval(eventType, joinedKeywords);
            if (cached.isPresent()) {
                log.debug("[PROMPT_BUILDER] Retrieval cache hit | eventType={} | keywords={}", eventType, joinedKeywords);
                return cached.get();
            }
        }

        String memoryContext;
        if (retrievalSource == null) {
            memoryContext = "";
        } else {
            RetrievalQuery query = RetrievalQuery.builder()
                .sceneType(scene)
                .interaction(interaction)
                .keywords(keywords)
                .indexCount(properties.isEnableMemoryIndex() ? properties.getMemoryIndexCount() : 0)
                .fulltextCount(properties.getMemoryFulltextCount())
                .build();
            try {
                String result = retrievalSource.retrieve(query);
                memoryContext = result == null ? "" : result;
            } catch (RuntimeException e) {
                log.warn("[PROMPT_BUILDER] Retrieval failed, continuing without memories | eventType={} | error={}",
                    eventType, e.getMessage());
                return "";
            }
        }

        if (properties.isEnableCache()) {
            cache.setRetrieval(eventType, joinedKeywords, memoryContext, properties.getRetrievalCacheTtl());
        }
        return memoryContext;
    }

    private String assemblePrompt(
            String identityContext,
            String workingContext,
            String factsSummary,
            String memoryContext,
            InteractionRequest interaction) {

        List<String> parts = new ArrayList<>();

        parts.add(identityContext);
        parts.add("");

        parts.add(workingContext);
        parts.add("");

        if (!factsSummary.isEmpty()) {
            parts.add(PromptSections.FACTS_HEADER);
            parts.add(factsSummary);
            parts.add("");
        }

        if (!memoryContext.isEmpty()) {
            parts.add(memoryContext);
            parts.add("");
        }

        parts.add(PromptSections.INSTRUCTIONS_HEADER);
        parts.add(PromptSections.INSTRUCTIONS);
        parts.add("");

        String content = interaction.getContent();
        parts.add(PromptSections.CURRENT_EVENT_HEADER);
        parts.add(PromptSections.USER_INPUT_PREFIX + (content == null || content.isEmpty() ? PromptSections.NO_INPUT : content));

        return String.join("\n", parts);
    }

    private BudgetProfile resolveProfile() {
        if (!properties.isAutoAdjustMode() || memoryVolumeSource == null) {
            return budgetPolicy.configuredProfile();
        }
        try {
            return budgetPolicy.select(memoryVolumeSource.countMemories());
        } catch (RuntimeException e) {
            log.warn("[PROMPT_BUILDER] Memory count unavailable, using configured profile | error={}", e.getMessage());
            return budgetPolicy.configuredProfile();
        }
    }

    private long currentStaticGeneration() {
        synchronized (invalidationLock) {
            return staticGeneration;
        }
    }

    private long currentSemiStaticGeneration() {
        synchronized (invalidationLock) {
            return semiStaticGeneration;
        }
    }

    static String summarizeFacts(List<String> preferences, List<String> patterns) {
        if (preferences.isEmpty() && patterns.isEmpty()) {
            return PromptSections.NO_FACTS;
        }
        List<String> lines = new ArrayList<>();
        if (!preferences.isEmpty()) {
            lines.add(PromptSections.PREFERENCES + " " + String.join("; ", preferences));
        }
        if (!patterns.isEmpty()) {
            lines.add(PromptSections.BEHAVIOR_PATTERNS + " " + String.join("; ", patterns));
        }
        return String.join("\n", lines);
    }

    private static List<String> nullToEmpty(List<String> list) {
        return list == null ? List.of() : list;
    }

    // ========== Invalidation entry points ==========

    /**
     * Call when the identity files change.
     */
    public void invalidateIdentityCache() {
        invalidateStatic(ContextKeys.IDENTITY);
        log.info("[PROMPT_BUILDER] Identity cache invalidated");
    }

    /**
     * Call when preferences or behaviour patterns change.
     */
    public void invalidateFactsCache() {
        invalidateSemiStatic(ContextKeys.FACTS_SUMMARY);
        log.info("[PROMPT_BUILDER] Facts cache invalidated");
    }

    public void invalidateStatic(String key) {
        synchronized (invalidationLock) {
            staticGeneration++;
            cache.invalidateStatic(key);
        }
    }

    public void invalidateSemiStatic(String key) {
        synchronized (invalidationLock) {
            semiStaticGeneration++;
            cache.invalidateSemiStatic(key);
        }
    }

    public void clearRetrievalCache() {
        cache.clearRetrievalCache();
    }

    public void clearCache() {
        synchronized (invalidationLock) {
            staticGeneration++;
            semiStaticGeneration++;
            cache.clearAll();
        }
    }

    public int sweepExpiredCache() {
        return cache.sweepExpired();
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }
}
