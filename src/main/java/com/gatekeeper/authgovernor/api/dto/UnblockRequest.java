package com.gatekeeper.authgovernor.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "Lift every active block for a phone number")
public record UnblockRequest(
        @Schema(example = "01012345678", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Phone number is required")
        String phoneNumber,

        @Schema(example = "Customer verified identity by phone")
        @Size(max = 500)
        String reason
) {
}
