package com.gatekeeper.authgovernor.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

public record DeactivateBlockRequest(
        @Schema(example = "False positive")
        @Size(max = 500)
        String reason
) {
}
