package com.hieshield.frauddetector.config;

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
    public OpenAPI hieFraudOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HIE Claims Fraud API")
                        .description("""
                                Rule-based fraud analysis of medical procedure claims exchanged between hospitals.

                                ## Rules
                                - Anatomical limits (e.g. no more than two leg amputations per patient)
                                - Cross-provider patterns (hospitals, insurers, patient name variants)
                                - Temporal anomalies (major procedures less than 7 days apart)

                                ## Authentication
                                All /fraud endpoints require a Bearer token with the DOCTOR or ADMIN role.
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
