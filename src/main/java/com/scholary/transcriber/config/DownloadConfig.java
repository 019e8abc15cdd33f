package com.scholary.transcriber.config;

import com.scholary.transcriber.download.DownloadProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the media download settings. */
@Configuration
@EnableConfigurationProperties(DownloadProperties.class)
public class DownloadConfig {}
