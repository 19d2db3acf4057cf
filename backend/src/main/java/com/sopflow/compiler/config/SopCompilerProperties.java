package com.sopflow.compiler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "sopflow.compiler")
@Validated
public record SopCompilerProperties(
    @DefaultValue("false")
    boolean strictMode,

    @Positive
    @DefaultValue("4")
    Integer tabWidth,

    @Positive
    @DefaultValue("100000")
    Integer maxSourceCodeLength,

    @NotBlank
    @DefaultValue("1.0.0")
    String compilerVersion,

    @Valid
    @NotNull
    @DefaultValue
    Augmentation augmentation
) {

    public record Augmentation(
        @DefaultValue("false")
        boolean enabled,

        @DefaultValue("false")
        boolean mandatory,

        @Positive
        @DefaultValue("30000")
        Long timeoutMs,

        String endpoint,

        String apiKey,

        @DefaultValue("gpt-4o-mini")
        String model
    ) {
    }

    public static SopCompilerProperties defaults() {
        return new SopCompilerProperties(false, 4, 100_000, "1.0.0",
            new Augmentation(false, false, 30_000L, null, null, "gpt-4o-mini"));
    }
}
