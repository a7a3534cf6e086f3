package com.ztverify.riskauth.config;

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
    public OpenAPI ztVerifyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ZT-Verify Risk-Adaptive Authentication API")
                        .description("""
                                Per-login trust decisions for credential-verified users.

                                ## Flow
                                - `POST /api/authenticate` scores the login and answers `allow`, `challenge` or `deny`
                                - on `challenge`, a one-time code is emailed; submit it to `POST /api/otp/complete`
                                - `allow` responses (direct or after the code) carry a Bearer session token

                                ## Risk scores
                                Scores are reported between 0.0 and 1.0. Below 0.30 is low risk, 0.70 and above is high.
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
                                        .description("Session token returned by an allowed login")));
    }
}
