package com.contextkit.api.controller;

import com.contextkit.api.dto.request.BuildPromptRequest;
import com.contextkit.api.dto.response.BuildPromptResponse;
import com.contextkit.core.prompt.ContextAssembler;
import com.contextkit.core.prompt.model.AssembledPrompt;
import com.contextkit.core.prompt.model.InteractionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/prompt")
@RequiredArgsConstructor
@Slf4j
public class PromptController {

    private final ContextAssembler contextAssembler;

    @PostMapping("/build")
    public ResponseEntity<BuildPromptResponse> build(@Valid @RequestBody BuildPromptRequest request) {
        log.debug("[API] Build prompt | scene={} | interactionType={}", request.getSceneType(), request.getInteractionType());

        InteractionRequest interaction = InteractionRequest.builder()
            .interactionType(request.getInteractionType())
            .content(request.getContent())
            .build();

        AssembledPrompt assembled = contextAssembler.assemble(
            request.getSceneType(), interaction, request.getMemoryHints());

        return ResponseEntity.ok(BuildPromptResponse.from(assembled));
    }
}
