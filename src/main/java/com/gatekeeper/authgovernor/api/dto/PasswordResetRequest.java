package com.gatekeeper.authgovernor.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@Schema(description = "Request a password reset code")
public record PasswordResetRequest(
        @Schema(example = "01012345678", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Phone number is required")
        @Pattern(regexp = "^\\+?[0-9]{6,20}$", message = "Phone number must contain 6 to 20 digits")
        String phoneNumber
) {
}
