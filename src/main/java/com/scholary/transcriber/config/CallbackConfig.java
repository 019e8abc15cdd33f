package com.scholary.transcriber.config;

import com.scholary.transcriber.callback.CallbackProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the webhook delivery settings. */
@Configuration
@EnableConfigurationProperties(CallbackProperties.class)
public class CallbackConfig {}
