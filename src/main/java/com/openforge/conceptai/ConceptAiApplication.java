package com.openforge.conceptai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ConceptAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConceptAiApplication.class, args);
    }
}
