package com.nevis.digest.service;

import com.nevis.digest.config.DigestProperties;
import com.nevis.digest.exception.EntityNotFoundException;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.DigestStatus;
import com.nevis.digest.model.FileDigestSummary;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.repository.ArchiveRepository;
import com.nevis.digest.repository.DigestRepository;
import com.nevis.digest.repository.FileRepository;
import com.nevis.digest.service.FileLockService.FileLock;
import com.nevis.digest.service.digester.Digester;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs every registered digester over one file in priority order and persists what they produce.
 * <p>
 * Digest rows are reloaded before each digester so later digesters see what earlier ones wrote
 * in the same pass. A failing digester only fails its own rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DigestCoordinator {

    static final String NOT_APPLICABLE = "Not applicable";
    static final String NO_OUTPUT = "No output produced";
    static final String OUTPUT_NOT_PRODUCED = "Output not produced";
    static final String NO_LONGER_REGISTERED = "Digester no longer registered";

    private enum Outcome { NONE, PROCESSED, SKIPPED, FAILED }

    private final DigesterRegistry digesterRegistry;
    private final DigestRepository digestRepository;
    private final FileRepository fileRepository;
    private final ArchiveRepository archiveRepository;
    private final FileLockService fileLockService;
    private final DigestProperties properties;
    private final Clock clock;

    public FileDigestSummary processFile(String filePath) {
        return processFile(filePath, false);
    }

    /**
     * One pass over the file while holding its lock. Placeholders are seeded first; with
     * {@code reset} every digest row of the file goes back to {@code todo} before that, so
     * the pass redoes all of them.
     */
    public FileDigestSummary processFile(String filePath, boolean reset) {
        Optional<FileLock> lock = fileLockService.tryAcquire(filePath);
        if (lock.isEmpty()) {
            log.debug("File {} is locked by another worker", filePath);
            return FileDigestSummary.lockedBy(filePath);
        }

        try (FileLock held = lock.get()) {
            FileRecord file = fileRepository.findByPath(filePath)
                .orElseThrow(() -> new EntityNotFoundException(filePath));

            if (reset) {
                int count = digestRepository.resetAllForFile(filePath, now());
                log.info("Reset {} digests of {}", count, filePath);
            }
            seedPlaceholders(filePath);

            int processed = 0;
            int skipped = 0;
            int failed = 0;
            for (Digester digester : digesterRegistry.getAll()) {
                if (!held.refresh()) {
                    log.warn("Lost the lock on {} before {}, abandoning the pass", filePath, digester.name());
                    break;
                }
                List<Digest> existing = digestRepository.findByFilePath(filePath);
                switch (runDigester(file, digester, existing)) {
                    case PROCESSED -> processed++;
                    case SKIPPED -> skipped++;
                    case FAILED -> failed++;
                    default -> { }
                }
            }

            if (processed + skipped + failed > 0) {
                log.info("Digested {}: {} processed, {} skipped, {} failed", filePath, processed, skipped, failed);
            }
            return new FileDigestSummary(filePath, false, processed, skipped, failed);
        }
    }

    /**
     * Creates {@code todo} rows for every registered digest type and retires rows of digesters
     * that are no longer registered. A file locked by another worker is left to that worker,
     * which seeds placeholders at the start of its pass.
     *
     * @return number of rows created
     */
    public int ensureDigestPlaceholders(String filePath) {
        Optional<FileLock> lock = fileLockService.tryAcquire(filePath);
        if (lock.isEmpty()) {
            log.debug("File {} is locked by another worker, not seeding placeholders", filePath);
            return 0;
        }

        try (FileLock ignored = lock.get()) {
            return seedPlaceholders(filePath);
        }
    }

    private int seedPlaceholders(String filePath) {
        List<String> types = digesterRegistry.getAllDigestTypes();
        OffsetDateTime now = now();
        int created = digestRepository.insertMissing(filePath, types, now);

        Set<String> registered = new HashSet<>(types);
        for (Digest digest : digestRepository.findByFilePath(filePath)) {
            if (!registered.contains(digest.digester()) && digest.status() != DigestStatus.SKIPPED) {
                digestRepository.upsert(new Digest(digest.id(), filePath, digest.digester(), DigestStatus.SKIPPED,
                    digest.content(), digest.archiveName(), NO_LONGER_REGISTERED, digest.attempts(),
                    digest.createdAt(), now));
                log.info("Retired digest {} of {}: digester is no longer registered", digest.digester(), filePath);
            }
        }
        return created;
    }

    private Outcome runDigester(FileRecord file, Digester digester, List<Digest> existing) {
        Map<String, Digest> byType = existing.stream()
            .collect(Collectors.toMap(Digest::digester, Function.identity(), (a, b) -> a));
        List<String> outputs = digester.outputs();

        // the stale sweep recovers rows abandoned in progress
        if (outputs.stream().map(byType::get).anyMatch(d -> d != null && d.status() == DigestStatus.IN_PROGRESS)) {
            return Outcome.NONE;
        }

        List<String> pending = outputs.stream()
            .filter(type -> isPending(byType.get(type)))
            .toList();

        if (pending.isEmpty()) {
            List<String> terminal = outputs.stream()
                .filter(type -> byType.get(type) != null && byType.get(type).status().isTerminal())
                .toList();
            if (terminal.isEmpty() || !shouldReprocess(file, digester, existing)) {
                return Outcome.NONE;
            }
            log.info("Reprocessing {} for {}: upstream content changed", digester.name(), file.path());
            resetToTodo(file.path(), terminal, byType);
            pending = terminal;
        }

        try {
            if (!digester.canDigest(file, existing)) {
                markAll(file.path(), pending, byType, DigestStatus.SKIPPED, NOT_APPLICABLE);
                return Outcome.SKIPPED;
            }
        } catch (RuntimeException e) {
            return recordFailure(file, digester, pending, byType, e);
        }

        markAll(file.path(), pending, byType, DigestStatus.IN_PROGRESS, null);

        List<DigestInput> results;
        try {
            results = digester.digest(file, existing);
        } catch (RuntimeException e) {
            return recordFailure(file, digester, pending, byType, e);
        }

        if (results == null) {
            markAll(file.path(), pending, byType, DigestStatus.SKIPPED, NO_OUTPUT);
            return Outcome.SKIPPED;
        }

        boolean anyFailed = false;
        Set<String> produced = new HashSet<>();
        for (DigestInput input : results) {
            if (!outputs.contains(input.digester())) {
                log.warn("Digester {} returned undeclared output {} for {}, ignoring",
                    digester.name(), input.digester(), file.path());
                continue;
            }
            persist(file.path(), input, byType.get(input.digester()));
            produced.add(input.digester());
            anyFailed |= input.status() == DigestStatus.FAILED;
        }

        List<String> missing = pending.stream().filter(type -> !produced.contains(type)).toList();
        if (!missing.isEmpty()) {
            markAll(file.path(), missing, byType, DigestStatus.FAILED, OUTPUT_NOT_PRODUCED);
            anyFailed = true;
        }
        return anyFailed ? Outcome.FAILED : Outcome.PROCESSED;
    }

    private boolean isPending(Digest digest) {
        if (digest == null || digest.status() == DigestStatus.TODO) {
            return true;
        }
        return digest.status() == DigestStatus.FAILED && digest.attempts() < properties.maxAttempts();
    }

    private boolean shouldReprocess(FileRecord file, Digester digester, List<Digest> existing) {
        try {
            return digester.shouldReprocessCompleted(file, existing);
        } catch (RuntimeException e) {
            log.warn("Reprocess check of {} failed for {}: {}", digester.name(), file.path(), e.getMessage());
            return false;
        }
    }

    private Outcome recordFailure(FileRecord file, Digester digester, List<String> pending,
                                  Map<String, Digest> byType, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.warn("Digester {} failed for {}: {}", digester.name(), file.path(), message, e);
        markAll(file.path(), pending, byType, DigestStatus.FAILED, message);
        return Outcome.FAILED;
    }

    private void resetToTodo(String filePath, List<String> types, Map<String, Digest> byType) {
        OffsetDateTime now = now();
        for (String type : types) {
            Digest previous = byType.get(type);
            Digest reset = new Digest(Digest.idFor(filePath, type), filePath, type, DigestStatus.TODO,
                null, null, null, 0, previous.createdAt(), now);
            digestRepository.upsert(reset);
            byType.put(type, reset);
        }
    }

    private void markAll(String filePath, List<String> types, Map<String, Digest> byType,
                         DigestStatus status, String error) {
        for (String type : types) {
            persist(filePath, new DigestInput(type, status, null, null, null, error), byType.get(type));
        }
    }

    private void persist(String filePath, DigestInput input, Digest previous) {
        OffsetDateTime now = now();
        int previousAttempts = previous != null ? previous.attempts() : 0;
        int attempts = switch (input.status()) {
            case COMPLETED, SKIPPED -> 0;
            case FAILED -> Math.min(previousAttempts + 1, properties.maxAttempts());
            default -> previousAttempts;
        };

        // in-progress keeps whatever the row held so a crash leaves the last good content
        String content = input.content();
        String archiveName = input.archiveName();
        if (input.status() == DigestStatus.IN_PROGRESS && previous != null) {
            content = previous.content();
            archiveName = previous.archiveName();
        }

        if (input.archiveData() != null && archiveName != null) {
            archiveRepository.save(archiveName, input.archiveData());
        }

        digestRepository.upsert(new Digest(
            Digest.idFor(filePath, input.digester()),
            filePath,
            input.digester(),
            input.status(),
            content,
            archiveName,
            input.error(),
            attempts,
            previous != null ? previous.createdAt() : now,
            now
        ));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
