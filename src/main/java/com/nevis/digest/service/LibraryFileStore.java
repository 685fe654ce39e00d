package com.nevis.digest.service;

import com.nevis.digest.config.DigestProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves library-relative paths against the data root.
 */
@Slf4j
@Component
public class LibraryFileStore {

    private final Path root;

    public LibraryFileStore(DigestProperties properties) {
        this.root = Path.of(properties.dataRoot()).toAbsolutePath().normalize();
    }

    public Path resolve(String filePath) {
        Path resolved = root.resolve(filePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the data root: " + filePath);
        }
        return resolved;
    }

    public byte[] readBytes(String filePath) {
        try {
            return Files.readAllBytes(resolve(filePath));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + filePath, e);
        }
    }

    public Optional<String> readText(String filePath) {
        try {
            return Optional.of(Files.readString(resolve(filePath), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read text file {}: {}", filePath, e.getMessage());
            return Optional.empty();
        }
    }
}
