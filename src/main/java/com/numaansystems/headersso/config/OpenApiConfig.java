package com.numaansystems.headersso.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI metadata for the diagnostic endpoints.
 *
 * <h2>Access</h2>
 * <ul>
 *   <li>Swagger UI: /swagger-ui.html</li>
 *   <li>OpenAPI JSON: /v3/api-docs</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI headerSsoOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Header SSO API")
                .description("Identity established from trusted proxy headers")
                .version("0.1.0")
                .contact(new Contact()
                    .name("Numaan Systems")
                    .email("support@numaansystems.com")));
    }
}
