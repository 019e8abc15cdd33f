package com.scholary.transcriber.config;

import com.scholary.transcriber.diarization.DiarizationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the DiarizationProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(DiarizationProperties.class)
public class DiarizationConfig {}
