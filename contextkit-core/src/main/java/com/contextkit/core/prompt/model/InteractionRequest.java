package com.contextkit.core.prompt.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class InteractionRequest {
    private String interactionType; // e.g. "conversation", "click", "proactive"
    private String content;         // raw user input, may be null
}
