package com.library.circulation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI circulationOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("School Library Circulation API")
                .description("Borrowing and returning book copies, overdue detection, "
                    + "severity-tiered blacklisting and audited manual unblacklisting.")
                .version("1.0.0"));
    }
}
