package com.example.templatelocator;

import com.example.templatelocator.config.MatchingProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Template Locator API",
                version = "1.0",
                description = "REST API for locating occurrences of a template image inside a scene image.",
                contact = @Contact(name = "Template Locator")))
@SpringBootApplication
@EnableConfigurationProperties(MatchingProperties.class)
public class TemplateLocatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TemplateLocatorApplication.class, args);
    }
}
