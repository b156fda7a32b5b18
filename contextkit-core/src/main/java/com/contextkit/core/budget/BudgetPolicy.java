package com.contextkit.core.budget;

import com.contextkit.core.config.PromptBuilderProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the budget profile for a build.
 */
@Slf4j
public class BudgetPolicy {

    private final PromptBuilderProperties properties;

    public BudgetPolicy(PromptBuilderProperties properties) {
        if (properties.getMemoryCountThresholdLite() >= properties.getMemoryCountThresholdStandard()) {
            throw new IllegalArgumentException(
                "memory-count-threshold-lite must be lower than memory-count-threshold-standard");
        }
        this.properties = properties;
    }

    public BudgetProfile configuredProfile() {
        return properties.getMode();
    }

    /**
     * Select a profile from the total number of stored memories.
     * Falls back to the configured profile when auto-adjust is off.
     */
    public BudgetProfile select(long memoryCount) {
        if (!properties.isAutoAdjustMode()) {
            return properties.getMode();
        }

        BudgetProfile profile;
        if (memoryCount < properties.getMemoryCountThresholdLite()) {
            // New user: little to index, favour conversation history
            profile = BudgetProfile.LITE;
        } else if (memoryCount < properties.getMemoryCountThresholdStandard()) {
            profile = BudgetProfile.STANDARD;
        } else {
            // Long-time user: room for index and full text
            profile = BudgetProfile.DEEP;
        }

        log.debug("[BUDGET] Profile selected by memory count | memoryCount={} | profile={}", memoryCount, profile);
        return profile;
    }

    public SizeBudget budgetFor(BudgetProfile profile) {
        return profile.getBudget();
    }
}
