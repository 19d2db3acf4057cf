package com.sopflow.compiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SopflowCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SopflowCompilerApplication.class, args);
    }
}
