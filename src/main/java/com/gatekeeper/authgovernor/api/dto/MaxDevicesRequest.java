package com.gatekeeper.authgovernor.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record MaxDevicesRequest(
        @Schema(example = "3", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "maxAllowedDevices is required")
        @Min(value = 1, message = "At least one device must be allowed")
        @Max(value = 20, message = "At most 20 devices can be allowed")
        Integer maxAllowedDevices
) {
}
