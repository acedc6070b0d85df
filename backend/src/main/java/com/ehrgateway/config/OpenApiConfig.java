package com.ehrgateway.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;

@Configuration
public class OpenApiConfig {

    @Value("${gateway.name:OpenEMR API Interface}")
    private String name;

    @Value("${gateway.version:1.0.0}")
    private String version;

    @Bean
    public OpenAPI gatewayOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title(name)
                        .version(version)
                        .description("REST interface for OpenEMR: OAuth 2.0, FHIR R4 and the Standard API. "
                                + "Protected endpoints expect an `Authorization: Bearer <token>` header "
                                + "obtained from /oauth/token."))
                .components(new Components()
                        .addSecuritySchemes("bearer", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")))
                .tags(List.of(
                        new Tag().name("Authentication").description("OAuth 2.0 token management and client registration"),
                        new Tag().name("FHIR").description("FHIR R4 API"),
                        new Tag().name("Standard API").description("Native OpenEMR REST API")));
    }
}
