package com.contextkit.core.prompt.model;

import com.contextkit.core.budget.BudgetProfile;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AssembledPrompt {
    private String text;
    private BudgetProfile profile;
    private int estimatedSize;     // before enforcement, -1 when counting is disabled
    private int availableBudget;
    private boolean truncated;
    private boolean retrievalSkipped;
    private long durationMs;
}
