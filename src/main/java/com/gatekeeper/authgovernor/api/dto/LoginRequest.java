package com.gatekeeper.authgovernor.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(description = "Login request")
public record LoginRequest(
        @Schema(description = "Registered phone number", example = "01012345678", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Phone number is required")
        @Pattern(regexp = "^\\+?[0-9]{6,20}$", message = "Phone number must contain 6 to 20 digits")
        String phoneNumber,

        @Schema(description = "Account password", example = "S3cure!pass", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Password is required")
        @Size(max = 128, message = "Password is too long")
        String password,

        @Schema(description = "Stable hardware identifier reported by the app (Android ID / iOS vendor ID)",
                example = "a1b2c3d4e5f6")
        @Size(max = 255)
        String deviceId,

        @Schema(description = "Display name for the device; derived from the user agent when absent", example = "Pixel 8")
        @Size(max = 200)
        String deviceName
) {
}
