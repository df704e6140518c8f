package com.project.items.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** API description served at {@code /v3/api-docs}, browsable at {@code /docs}. */
@Configuration
public class OpenApiConfig {

    public static final String API_VERSION = "1.0.0";

    @Bean
    public OpenAPI itemServiceApi() {
        return new OpenAPI().info(new Info()
                .title("Item Service API")
                .description("CRUD service over a single Item table, with health and Prometheus metrics")
                .version(API_VERSION));
    }
}
