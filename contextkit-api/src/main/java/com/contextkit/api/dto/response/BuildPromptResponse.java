package com.contextkit.api.dto.response;

import com.contextkit.core.budget.BudgetProfile;
import com.contextkit.core.prompt.model.AssembledPrompt;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildPromptResponse {
    private String prompt;
    private Metadata metadata;

    public static BuildPromptResponse from(AssembledPrompt assembled) {
        return BuildPromptResponse.builder()
            .prompt(assembled.getText())
            .metadata(Metadata.builder()
                .profile(assembled.getProfile())
                .estimatedSize(assembled.getEstimatedSize())
                .availableBudget(assembled.getAvailableBudget())
                .truncated(assembled.isTruncated())
                .retrievalSkipped(assembled.isRetrievalSkipped())
                .durationMs(assembled.getDurationMs())
                .build())
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private BudgetProfile profile;
        private Integer estimatedSize;   // -1 when counting is disabled
        private Integer availableBudget;
        private Boolean truncated;
        private Boolean retrievalSkipped;
        private Long durationMs;
    }
}
