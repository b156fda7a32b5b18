package com.contextkit.core.prompt.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Descriptor handed to the long-term memory retrieval source.
 */
@Data
@Builder
public class RetrievalQuery {
    private SceneType sceneType;
    private InteractionRequest interaction;
    private List<String> keywords;
    private int indexCount;      // 0 when the memory index is disabled
    private int fulltextCount;
}
