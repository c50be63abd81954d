package com.mcpgateway.registry.search.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to enable or disable an indexed entity")
public class EntityStateRequest {

    @NotBlank
    @Schema(description = "Path of the server or agent", example = "/weather-api", requiredMode = Schema.RequiredMode.REQUIRED)
    private String path;

    @NotNull
    @Schema(description = "New enabled state", example = "false", requiredMode = Schema.RequiredMode.REQUIRED)
    private Boolean enabled;
}
