package com.nevis.digest.service;

import com.nevis.digest.config.DigestProperties;
import com.nevis.digest.repository.FileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class FileSelector {

    private final FileRepository fileRepository;
    private final DigesterRegistry digesterRegistry;
    private final DigestProperties properties;

    /**
     * Files with at least one digest type that was never run, is waiting, or failed with
     * attempts left. Files whose remaining work is exhausted retries are not returned.
     */
    public List<String> findFilesNeedingDigestion(int limit) {
        return fileRepository.findPathsNeedingDigestion(
            digesterRegistry.getAllDigestTypes(),
            properties.excludedPrefixes(),
            properties.maxAttempts(),
            limit
        );
    }
}
