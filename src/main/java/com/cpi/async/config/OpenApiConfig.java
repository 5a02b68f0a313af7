package com.cpi.async.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI/Swagger documentation of the trigger endpoint.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8000}")
    private String serverPort;

    @Bean
    public OpenAPI cpiServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Personal CPI Async Service API")
                        .description("Accepts calculation triggers and computes a personal price index " +
                                    "in the background, delivering the result to the main service " +
                                    "through a callback.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development server")
                ));
    }
}
