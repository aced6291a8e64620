package com.gatekeeper.authgovernor.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(description = "Complete a password reset with the code that was sent")
public record PasswordResetConfirmRequest(
        @Schema(example = "01012345678", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Phone number is required")
        @Pattern(regexp = "^\\+?[0-9]{6,20}$", message = "Phone number must contain 6 to 20 digits")
        String phoneNumber,

        @Schema(description = "6-digit reset code", example = "482913", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Code is required")
        @Pattern(regexp = "^[0-9]{6}$", message = "Code must be 6 digits")
        String code,

        @Schema(example = "N3w-passw0rd", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "New password is required")
        @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
        String newPassword
) {
}
