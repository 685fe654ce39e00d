package com.nevis.digest.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record FileEventRequest(
    @NotBlank String path,
    @JsonProperty("is_new") boolean isNew,
    @JsonProperty("content_changed") boolean contentChanged
) {}
