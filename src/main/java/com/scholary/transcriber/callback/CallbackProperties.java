package com.scholary.transcriber.callback;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for webhook delivery. */
@ConfigurationProperties(prefix = "callback")
@Validated
public record CallbackProperties(@Positive int timeoutSeconds, @NotBlank String signatureHeader) {}
