package com.plant.hierarchy.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI plantHierarchyOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080");
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Plant Hierarchy API")
                .version("1.0.0")
                .description("Per-plant management of the equipment hierarchy (colon-delimited label paths) " +
                        "and of the SVG icons attached to hierarchy nodes.");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
