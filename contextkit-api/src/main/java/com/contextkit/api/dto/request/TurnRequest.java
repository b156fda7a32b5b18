package com.contextkit.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TurnRequest {

    @NotBlank(message = "Turn text is required")
    private String text;
}
