package com.contextkit.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StateRequest {

    @NotNull(message = "State value is required")
    private String value;
}
