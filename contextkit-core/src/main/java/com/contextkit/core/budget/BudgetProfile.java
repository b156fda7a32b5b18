package com.contextkit.core.budget;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Prompt budget profiles: small, medium and large.
 */
@Getter
@RequiredArgsConstructor
public enum BudgetProfile {

    LITE(
        new SizeBudget(
            1500,    // identity: character + user profile
            4000,    // recent conversation + live state
            500,     // time / weather / system
            1500,    // preference summary
            1500,    // memory index list
            1500,    // high-priority memory full text
            500,     // instructions
            5000,    // reserved for model output
            16000
        )
    ),

    STANDARD(
        new SizeBudget(2500, 8000, 1000, 2500, 3000, 5000, 1000, 9000, 32000)
    ),

    DEEP(
        new SizeBudget(4000, 16000, 2000, 4000, 6000, 10000, 2000, 20000, 64000)
    );

    private final SizeBudget budget;
}
