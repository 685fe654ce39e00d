package com.nevis.digest.controller;

import com.nevis.digest.event.FileChangedEvent;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for the library scanner to report file changes.
 */
@RestController
@RequiredArgsConstructor
public class FileEventController {

    private final ApplicationEventPublisher eventPublisher;

    @PostMapping("/api/files/events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void fileChanged(@Valid @RequestBody FileEventRequest request) {
        eventPublisher.publishEvent(new FileChangedEvent(request.path(), request.isNew(), request.contentChanged()));
    }
}
