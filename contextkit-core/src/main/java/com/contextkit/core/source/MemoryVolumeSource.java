package com.contextkit.core.source;

public interface MemoryVolumeSource {

    long countMemories();
}
