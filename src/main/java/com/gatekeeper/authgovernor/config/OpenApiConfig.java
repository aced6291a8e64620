// ==============================================================================
// OpenAPI/Swagger Configuration
// File: src/main/java/com/gatekeeper/authgovernor/config/OpenApiConfig.java
// ==============================================================================

package com.gatekeeper.authgovernor.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI authGovernorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Auth Governor API")
                        .description("""
                                Phone-number authentication guarded by progressive blocking and device-capped sessions.
                                
                                ## Blocking
                                Repeated failed login or password-reset attempts for a number inside a sliding
                                window open a temporary block. Each new block in a streak lasts longer.
                                Blocked requests receive `429` with `Retry-After` and a bilingual notice.
                                
                                ## Devices
                                Student accounts may be signed in on a limited number of devices. Signing in on
                                a new device signs out the least recently used one. Requests from a signed-out
                                device receive `401` with code `device_token_invalid`.
                                
                                ## Authentication
                                Protected endpoints require a Bearer token from `/auth/login`.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter JWT Bearer token")));
    }
}
