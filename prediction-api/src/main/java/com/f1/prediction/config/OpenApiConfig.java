package com.f1.prediction.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("F1 Race Prediction API")
                        .version("1.0.0")
                        .description("Leakage-safe pre-race features and win, position and points predictions for Formula 1 events.")
                        .contact(new Contact().name("F1 Prediction").email("prediction@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8082").description("Local Development"),
                        new Server().url("http://prediction-api:8080").description("Docker")
                ));
    }
}
