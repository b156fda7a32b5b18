package com.contextkit.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String code;      // stable machine-readable reason, see ErrorCode
    private String error;
    private String message;
    private Integer status;
    private Instant timestamp;
    private String path;

    public enum ErrorCode {
        VALIDATION_FAILED,
        MALFORMED_REQUEST,
        PROMPT_BUILDER_UNAVAILABLE,
        INTERNAL_ERROR
    }
}
