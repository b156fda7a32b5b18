package com.contextkit.core.budget;

import com.contextkit.common.util.SizeEstimator;
import com.contextkit.core.config.PromptBuilderProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * Final pipeline step: keeps the assembled prompt within
 * {@code total - reservedOutput} of the active profile.
 */
@Slf4j
public class BudgetEnforcer {

    private final PromptBuilderProperties properties;

    public BudgetEnforcer(PromptBuilderProperties properties) {
        this.properties = properties;
    }

    public BudgetCheck enforce(String prompt, SizeBudget budget) {
        int available = budget.available();

        if (!properties.isEnableTokenCounting()) {
            return new BudgetCheck(prompt, -1, available, false);
        }

        int estimated = SizeEstimator.estimate(prompt);
        if (estimated <= available) {
            return new BudgetCheck(prompt, estimated, available, false);
        }

        String fitted;
        if (!properties.isEnableCompression()) {
            fitted = truncateProportionally(prompt, available, estimated);
            log.warn("[BUDGET] Prompt over budget, truncated | estimatedSize={} | available={} | originalLength={} | newLength={}",
                estimated, available, prompt.length(), fitted.length());
        } else {
            // TODO: shrink low-priority sections (retrieval, then facts) before cutting the tail
            fitted = truncateProportionally(prompt, available, estimated);
            log.warn("[BUDGET] Prompt over budget, compressed proportionally | estimatedSize={} | available={} | ratio={} | newLength={}",
                estimated, available, String.format("%.3f", (double) available / estimated), fitted.length());
        }

        return new BudgetCheck(fitted, estimated, available, true);
    }

    /**
     * Cuts {@code text} to {@code floor(length * available / estimated)} characters,
     * counting code points so a surrogate pair is never split.
     */
    public static String truncateProportionally(String text, int available, int estimated) {
        if (text == null || text.isEmpty() || estimated <= 0) {
            return text;
        }
        int length = text.codePointCount(0, text.length());
        long keep = (long) length * Math.max(0, available) / estimated;
        if (keep >= length) {
            return text;
        }
        int end = text.offsetByCodePoints(0, (int) keep);
        return text.substring(0, end);
    }

    /**
     * Outcome of a budget check. {@code estimatedSize} is -1 when counting is disabled.
     */
    public record BudgetCheck(String text, int estimatedSize, int available, boolean truncated) {}
}
