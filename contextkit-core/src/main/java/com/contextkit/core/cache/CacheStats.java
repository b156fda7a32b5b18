package com.contextkit.core.cache;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CacheStats {
    private PartitionStats staticPartition;
    private PartitionStats semiStaticPartition;
    private PartitionStats retrievalPartition;

    public long getTotalEstimatedSize() {
        return staticPartition.getEstimatedSize()
            + semiStaticPartition.getEstimatedSize()
            + retrievalPartition.getEstimatedSize();
    }

    public int getTotalEntries() {
        return staticPartition.getEntryCount()
            + semiStaticPartition.getEntryCount()
            + retrievalPartition.getEntryCount();
    }

    @Data
    @Builder
    public static class PartitionStats {
        private int entryCount;
        private long estimatedSize;
    }
}
