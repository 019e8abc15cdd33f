package com.scholary.transcriber.download;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for generic media downloads.
 *
 * <p>Timeouts are in seconds. {@code readTimeout} is the longest an HTTP transfer may go without
 * receiving data. The buffer size bounds how much of an object-store download sits in memory.
 */
@ConfigurationProperties(prefix = "download")
@Validated
public record DownloadProperties(
    @Positive int connectTimeout, @Positive int readTimeout, @Positive int bufferSize) {}
