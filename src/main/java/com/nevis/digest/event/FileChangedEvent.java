package com.nevis.digest.event;

/**
 * Published when the library scanner sees a new file or a change to an existing one.
 */
public record FileChangedEvent(String filePath, boolean isNew, boolean contentChanged) {}
