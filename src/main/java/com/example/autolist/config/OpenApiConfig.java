package com.example.autolist.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger/OpenAPI 설정
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("사진 일괄 업로드 리스팅 자동화 API")
                        .description("사진을 일괄 업로드하면 상품별로 묶어 초안을 만들고, 2단계(prepare/publish)로 마켓플레이스에 게시하는 API")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Auto Service")
                                .email("support@example.com")));
    }
}
