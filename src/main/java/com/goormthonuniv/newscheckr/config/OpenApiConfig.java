package com.goormthonuniv.newscheckr.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI openAPI(@Value("${newscheckr.version:0.1.0}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title("NewsCheckr Analysis API")
                        .description("뉴스 기사 신뢰도 점수, 정치 성향, 추출 요약 분석 API")
                        .version("v" + version)
                        .license(new License().name("MIT")))
                .externalDocs(new ExternalDocumentation().description("Swagger UI").url("/swagger-ui.html"));
    }
}
