package com.demo.thrift.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI thriftOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("Thrift Protocol API")
                .description("Savings groups: lifecycle, escrow, stakes, insurance claims. "
                        + "Callers identify themselves with the X-Caller-Address header.")
                .version("v1"));
    }
}
