package com.nevis.digest.model;

public record WorkerStatus(
    boolean running,
    boolean paused,
    int activeTasks
) {}
