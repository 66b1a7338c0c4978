package com.kirimba.userapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация OpenAPI (Swagger) для документации REST API.
 * Группа v1 покрывает пользовательские эндпоинты и health-check.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI userApiInfo() {
        return new OpenAPI()
                .info(new Info()
                        .title("User API")
                        .version("v1.0")
                        .description("CRUD для пользователей, возраст вычисляется из даты рождения"));
    }

    @Bean
    public GroupedOpenApi v1Api() {
        return GroupedOpenApi.builder()
                .group("v1")
                .pathsToMatch("/api/v1/**", "/health")
                .build();
    }

}
