package com.contextkit.core.budget;

/**
 * Size allotments of one budget profile. Component allotments are advisory;
 * only {@link #available()} is enforced on the assembled prompt.
 */
public record SizeBudget(
        int identity,
        int workingMemory,
        int environment,
        int summary,
        int index,
        int fulltext,
        int instructions,
        int reservedOutput,
        int total
) {

    public int available() {
        return total - reservedOutput;
    }
}
