package com.contextkit.api.controller;

import com.contextkit.api.exception.GlobalExceptionHandler;
import com.contextkit.core.prompt.ContextAssembler;
import com.contextkit.core.source.IdentitySource;
import com.contextkit.core.working.InMemoryWorkingState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PromptControllerTest {

    private InMemoryWorkingState workingState;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        workingState = new InMemoryWorkingState(10);
        IdentitySource identity = () -> "{Layer 1: Identity}\n[Character]\nTest pet";
        ContextAssembler assembler = ContextAssembler.builder()
            .identitySource(identity)
            .workingStateSource(workingState)
            .build();

        mvc = MockMvcBuilders
            .standaloneSetup(new PromptController(assembler), new WorkingMemoryController(workingState))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void buildsPromptWithMetadata() throws Exception {
        mvc.perform(post("/api/v1/prompt/build")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sceneType\":\"SIMPLE\",\"interactionType\":\"conversation\",\"content\":\"hello\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.prompt", endsWith("User input: hello")))
            .andExpect(jsonPath("$.metadata.profile").value("STANDARD"))
            .andExpect(jsonPath("$.metadata.truncated").value(false))
            .andExpect(jsonPath("$.metadata.retrievalSkipped").value(true));
    }

    @Test
    void workingMemoryFeedsNextPrompt() throws Exception {
        mvc.perform(post("/api/v1/working-memory/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"user: I am tired\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.turns").value(1));
        mvc.perform(put("/api/v1/working-memory/state/mood")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":\"sleepy\"}"))
            .andExpect(status().isOk());

        mvc.perform(post("/api/v1/prompt/build")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sceneType\":\"SIMPLE\",\"interactionType\":\"conversation\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.prompt", containsString("- user: I am tired")))
            .andExpect(jsonPath("$.prompt", containsString("[Real-time State]\nmood: sleepy")))
            .andExpect(jsonPath("$.prompt", endsWith("User input: [none]")));
    }

    @Test
    void missingInteractionTypeIsRejected() throws Exception {
        mvc.perform(post("/api/v1/prompt/build")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sceneType\":\"MEDIUM\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.message").value("Validation failed"))
            .andExpect(jsonPath("$.error", containsString("interactionType")));
    }

    @Test
    void unknownSceneTypeIsRejected() throws Exception {
        mvc.perform(post("/api/v1/prompt/build")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sceneType\":\"HUGE\",\"interactionType\":\"conversation\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void missingCollaboratorMapsToServiceUnavailable() throws Exception {
        ContextAssembler unwired = ContextAssembler.builder().workingStateSource(workingState).build();
        MockMvc unwiredMvc = MockMvcBuilders
            .standaloneSetup(new PromptController(unwired))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();

        unwiredMvc.perform(post("/api/v1/prompt/build")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sceneType\":\"MEDIUM\",\"interactionType\":\"conversation\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value(503))
            .andExpect(jsonPath("$.code").value("PROMPT_BUILDER_UNAVAILABLE"))
            .andExpect(jsonPath("$.path").value("/api/v1/prompt/build"));
    }
}
