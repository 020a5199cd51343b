package com.deliverzler.triptracking.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI openAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Trip Tracking Engine API")
                        .description("Trip lifecycle, background GPS tracking and offline GPS synchronization for delivery drivers")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Device agent")
                ));
    }
}
