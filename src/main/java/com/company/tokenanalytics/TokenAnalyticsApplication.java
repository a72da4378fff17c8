package com.company.tokenanalytics;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Token Analytics API",
                version = "1.0.0",
                description = "Token usage analytics over Azure Log Analytics (Application Insights traces)"
        )
)
@SecurityScheme(
        name = "bearer-jwt",
        type = SecuritySchemeType.HTTP,
        scheme = "bearer",
        bearerFormat = "JWT"
)
public class TokenAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenAnalyticsApplication.class, args);
    }
}
