package com.roboticsradar.pipeline.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    private static final String ADMIN_KEY = "adminKey";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme adminKeyScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("x-admin-key");

        return new OpenAPI()
                .info(new Info()
                        .title("Robotics Radar Pipeline API")
                        .version("0.1.0")
                        .description("Ingestion cycles, ranked items and rescoring for the Robotics Radar feed."))
                .components(new Components().addSecuritySchemes(ADMIN_KEY, adminKeyScheme));
    }

    /** Every POST route (cycle trigger, rescoring) is admin-only; reads are public. */
    @Bean
    public OpenApiCustomizer adminSecurityCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            SecurityRequirement adminRequirement = new SecurityRequirement().addList(ADMIN_KEY);
            openAPI.getPaths().forEach((path, item) -> {
                boolean adminPath = path.startsWith("/cycle") || path.startsWith("/items");
                Operation post = item.getPost();
                if (adminPath && post != null) {
                    post.addSecurityItem(adminRequirement);
                }
            });
        };
    }
}
