package com.example.clubservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI with the bearer scheme used by every non-public route.
 */
@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "Bearer Authentication";

    @Bean
    public OpenAPI clubServiceOpenAPI(@Value("${spring.application.name:club-service}") String applicationName) {
        SecurityScheme accessToken = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("Access token from POST /api/auth/login, valid 15 minutes");

        return new OpenAPI()
                .info(new Info()
                        .title("Club Service API")
                        .version("1.0")
                        .description(applicationName + ": credentials, tenant isolation and audit trail"))
                .addTagsItem(new Tag().name("Auth").description("Login, refresh, register, logout"))
                .addTagsItem(new Tag().name("Audit logs").description("Organization audit trail, ADMIN and COACH"))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, accessToken));
    }
}
