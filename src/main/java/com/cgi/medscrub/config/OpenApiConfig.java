package com.cgi.medscrub.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MedScrub API")
                        .version("1.0")
                        .description("De-identification of clinical notes with salted, consistent placeholders")
                        .contact(new Contact().name("CGI").url("https://www.cgi.com")))
                .addTagsItem(new Tag().name("Scrubber").description("API for removing personal information from medical text"));
    }
}
