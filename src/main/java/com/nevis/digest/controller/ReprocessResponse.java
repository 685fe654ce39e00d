package com.nevis.digest.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record ReprocessResponse(
    @JsonProperty("task_id") UUID taskId,
    @JsonProperty("file_path") String filePath
) {}
