package com.example.facelandmarker;

import com.example.facelandmarker.config.FaceLandmarkerProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Face Landmarker API",
                version = "1.0",
                description = "REST API for detecting face landmarks and blendshapes on uploaded images.",
                contact = @Contact(name = "Face Landmarker")))
@SpringBootApplication
@EnableConfigurationProperties(FaceLandmarkerProperties.class)
public class FaceLandmarkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaceLandmarkerApplication.class, args);
    }
}
