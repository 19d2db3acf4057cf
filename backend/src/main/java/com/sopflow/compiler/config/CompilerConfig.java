package com.sopflow.compiler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sopflow.compiler.augment.AugmentationClient;
import com.sopflow.compiler.augment.OpenAiCompatibleAugmentationClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CompilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "sopflow.compiler.augmentation", name = "endpoint")
    public AugmentationClient augmentationClient(SopCompilerProperties properties, ObjectMapper objectMapper) {
        SopCompilerProperties.Augmentation augmentation = properties.augmentation();
        logger.info("Augmentation client targets {} with model {}", augmentation.endpoint(), augmentation.model());
        return new OpenAiCompatibleAugmentationClient(objectMapper,
            augmentation.endpoint(), augmentation.apiKey(), augmentation.model());
    }
}
