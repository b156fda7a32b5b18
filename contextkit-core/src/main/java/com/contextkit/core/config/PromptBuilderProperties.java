package com.contextkit.core.config;

import com.contextkit.core.budget.BudgetProfile;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Prompt builder settings: profile selection, cache ttls, compression and
 * memory index sizing.
 */
@ConfigurationProperties(prefix = "contextkit.prompt")
@Getter
@Setter
public class PromptBuilderProperties {
    private BudgetProfile mode = BudgetProfile.STANDARD;

    // Memory index strategy, forwarded to the retrieval source
    private boolean enableMemoryIndex = true;
    private int memoryIndexCount = 30;
    private int memoryFulltextCount = 3;

    private boolean enableCache = true;
    private Duration staticCacheTtl = Duration.ZERO; // zero = until invalidated
    private Duration semiStaticCacheTtl = Duration.ofMinutes(10);
    private Duration retrievalCacheTtl = Duration.ofMinutes(5);

    private boolean enableCompression = true;
    private boolean enableTokenCounting = true;

    // Profile selection by total memory count: < lite -> LITE, < standard -> STANDARD, else DEEP
    private boolean autoAdjustMode = true;
    private long memoryCountThresholdLite = 100;
    private long memoryCountThresholdStandard = 1000;

    private int recentConversationLimit = 10;
}
