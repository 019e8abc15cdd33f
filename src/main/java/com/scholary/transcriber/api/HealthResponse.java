package com.scholary.transcriber.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("models_warm") boolean modelsWarm,
    @JsonProperty("active_jobs") int activeJobs) {}
