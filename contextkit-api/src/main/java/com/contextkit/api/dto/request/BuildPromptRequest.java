package com.contextkit.api.dto.request;

import com.contextkit.core.prompt.model.SceneType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class BuildPromptRequest {

    @NotNull(message = "Scene type is required")
    private SceneType sceneType;

    @NotBlank(message = "Interaction type is required")
    private String interactionType;

    private String content; // user input, may be empty

    private List<String> memoryHints;
}
