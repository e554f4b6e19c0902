package com.surveygateway.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI surveyGatewayOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Survey AI Gateway API")
                        .description("Chat proxy for survey widgets: hides the upstream API key and enforces per-caller limits")
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")));
    }
}
