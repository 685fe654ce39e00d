package com.nevis.digest.service;

import com.nevis.digest.config.DigestProperties;
import com.nevis.digest.exception.EntityNotFoundException;
import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.DigestStatus;
import com.nevis.digest.model.DigesterStats;
import com.nevis.digest.model.FileDigestSummary;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.repository.ArchiveRepository;
import com.nevis.digest.repository.DigestRepository;
import com.nevis.digest.repository.FileRepository;
import com.nevis.digest.repository.ProcessingLockRepository;
import com.nevis.digest.service.digester.Digester;
import com.nevis.digest.service.digester.Digests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigestCoordinatorTest {

    private static final String PHOTO = "photos/receipt.jpg";
    private static final int MAX_ATTEMPTS = 3;

    private MutableClock clock;
    private InMemoryDigestRepository digestRepository;
    private InMemoryFileRepository fileRepository;
    private InMemoryArchiveRepository archiveRepository;
    private InMemoryLockRepository lockRepository;
    private DigesterRegistry registry;
    private DigestCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
        digestRepository = new InMemoryDigestRepository();
        fileRepository = new InMemoryFileRepository();
        archiveRepository = new InMemoryArchiveRepository();
        lockRepository = new InMemoryLockRepository();
        registry = new DigesterRegistry();
        DigestProperties properties = new DigestProperties(true, MAX_ATTEMPTS, 10, 4, 10, 30, List.of(), "./data");
        coordinator = new DigestCoordinator(registry, digestRepository, fileRepository, archiveRepository,
            new FileLockService(lockRepository, clock), properties, clock);

        fileRepository.add(new FileRecord(PHOTO, "receipt.jpg", false, 1024L, "image/jpeg", "h1",
            now(), now(), null));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private Digest row(String digester) {
        return Digests.find(digestRepository.findByFilePath(PHOTO), digester).orElseThrow();
    }

    @Nested
    @DisplayName("Single pass")
    class SinglePass {

        @Test
        @DisplayName("Applicable digesters complete, inapplicable ones are skipped")
        void shouldDigestImage() {
            TestDigester ocr = TestDigester.of("image-ocr")
                .applicableWhen((file, digests) -> FileTypes.isImage(file.mimeType()))
                .producing((file, digests) -> List.of(DigestInput.completed("image-ocr", "TOTAL 42.00")));
            TestDigester markdown = TestDigester.of("doc-to-markdown")
                .applicableWhen((file, digests) -> "application/pdf".equals(file.mimeType()));
            TestDigester tags = TestDigester.of("tags")
                .producing((file, digests) -> List.of(DigestInput.completed("tags",
                    Digests.completed(digests, "image-ocr").map(d -> "{\"tags\":[\"receipt\"]}").orElse(null))));
            registry.initialize(List.of(ocr, markdown, tags));

            FileDigestSummary summary = coordinator.processFile(PHOTO);

            assertThat(summary).isEqualTo(new FileDigestSummary(PHOTO, false, 2, 1, 0));
            assertThat(row("image-ocr").status()).isEqualTo(DigestStatus.COMPLETED);
            assertThat(row("image-ocr").content()).isEqualTo("TOTAL 42.00");
            assertThat(row("doc-to-markdown").status()).isEqualTo(DigestStatus.SKIPPED);
            assertThat(row("doc-to-markdown").error()).isEqualTo(DigestCoordinator.NOT_APPLICABLE);
            assertThat(row("tags").content()).isEqualTo("{\"tags\":[\"receipt\"]}");
            assertThat(markdown.digestCalls).isZero();
            assertThat(lockRepository.owners).isEmpty();
        }

        @Test
        @DisplayName("A second pass over a fully digested file does nothing")
        void shouldBeIdempotent() {
            TestDigester ocr = TestDigester.of("image-ocr")
                .producing((file, digests) -> List.of(DigestInput.completed("image-ocr", "text")));
            registry.register(ocr);

            coordinator.processFile(PHOTO);
            FileDigestSummary second = coordinator.processFile(PHOTO);

            assertThat(second).isEqualTo(new FileDigestSummary(PHOTO, false, 0, 0, 0));
            assertThat(ocr.digestCalls).isEqualTo(1);
        }

        @Test
        @DisplayName("Rows are marked in progress while the digester runs, keeping earlier content")
        void shouldMarkInProgressDuringDigest() {
            digestRepository.upsert(new Digest(Digest.idFor(PHOTO, "image-ocr"), PHOTO, "image-ocr",
                DigestStatus.FAILED, "old text", null, "timeout", 1, now(), now()));
            List<Digest> seen = new ArrayList<>();
            registry.register(TestDigester.of("image-ocr").producing((file, digests) -> {
                seen.add(row("image-ocr"));
                return List.of(DigestInput.completed("image-ocr", "new text"));
            }));

            coordinator.processFile(PHOTO);

            assertThat(seen).singleElement().satisfies(digest -> {
                assertThat(digest.status()).isEqualTo(DigestStatus.IN_PROGRESS);
                assertThat(digest.content()).isEqualTo("old text");
            });
            assertThat(row("image-ocr").content()).isEqualTo("new text");
            assertThat(row("image-ocr").attempts()).isZero();
            assertThat(row("image-ocr").error()).isNull();
        }

        @Test
        @DisplayName("A digester returning nothing is recorded as skipped")
        void shouldSkipWhenNoOutput() {
            registry.register(TestDigester.of("image-ocr").producing((file, digests) -> null));

            FileDigestSummary summary = coordinator.processFile(PHOTO);

            assertThat(summary.skipped()).isEqualTo(1);
            assertThat(row("image-ocr").status()).isEqualTo(DigestStatus.SKIPPED);
            assertThat(row("image-ocr").error()).isEqualTo(DigestCoordinator.NO_OUTPUT);
        }

        @Test
        @DisplayName("Missing declared outputs fail and undeclared outputs are ignored")
        void shouldReconcileOutputs() {
            registry.register(TestDigester.of("url-crawl")
                .withOutputs("url-crawl-content", "url-crawl-screenshot")
                .producing((file, digests) -> List.of(
                    DigestInput.completed("url-crawl-content", "{\"markdown\":\"hi\"}"),
                    DigestInput.completed("surprise", "ignored"))));

            FileDigestSummary summary = coordinator.processFile(PHOTO);

            assertThat(summary.failed()).isEqualTo(1);
            assertThat(row("url-crawl-content").status()).isEqualTo(DigestStatus.COMPLETED);
            assertThat(row("url-crawl-screenshot").status()).isEqualTo(DigestStatus.FAILED);
            assertThat(row("url-crawl-screenshot").error()).isEqualTo(DigestCoordinator.OUTPUT_NOT_PRODUCED);
            assertThat(Digests.find(digestRepository.findByFilePath(PHOTO), "surprise")).isEmpty();
        }

        @Test
        @DisplayName("Binary outputs are stored in the archive table")
        void shouldStoreArchives() {
            byte[] png = {1, 2, 3};
            registry.register(TestDigester.of("url-crawl-screenshot")
                .producing((file, digests) -> List.of(
                    DigestInput.completedWithArchive("url-crawl-screenshot", PHOTO + "/shot.png", png))));

            coordinator.processFile(PHOTO);

            assertThat(row("url-crawl-screenshot").archiveName()).isEqualTo(PHOTO + "/shot.png");
            assertThat(archiveRepository.findByName(PHOTO + "/shot.png")).contains(png);
        }

        @Test
        @DisplayName("Digesters with an output already in progress are left alone")
        void shouldNotTouchInProgressRows() {
            digestRepository.upsert(new Digest(Digest.idFor(PHOTO, "image-ocr"), PHOTO, "image-ocr",
                DigestStatus.IN_PROGRESS, null, null, null, 0, now(), now()));
            TestDigester ocr = TestDigester.of("image-ocr");
            registry.register(ocr);

            coordinator.processFile(PHOTO);

            assertThat(ocr.digestCalls).isZero();
            assertThat(row("image-ocr").status()).isEqualTo(DigestStatus.IN_PROGRESS);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A throwing digester fails only its own rows")
        void shouldIsolateFailures() {
            registry.initialize(List.of(
                TestDigester.of("image-ocr").producing((file, digests) -> {
                    throw new IllegalStateException("vendor unavailable");
                }),
                TestDigester.of("tags").producing((file, digests) -> List.of(DigestInput.completed("tags", "{}")))
            ));

            FileDigestSummary summary = coordinator.processFile(PHOTO);

            assertThat(summary.failed()).isEqualTo(1);
            assertThat(summary.processed()).isEqualTo(1);
            assertThat(row("image-ocr").status()).isEqualTo(DigestStatus.FAILED);
            assertThat(row("image-ocr").error()).isEqualTo("vendor unavailable");
            assertThat(row("image-ocr").attempts()).isEqualTo(1);
            assertThat(row("tags").status()).isEqualTo(DigestStatus.COMPLETED);
        }

        @Test
        @DisplayName("A failing digester stops being retried once it reaches the attempt ceiling")
        void shouldStopAtAttemptCeiling() {
            TestDigester ocr = TestDigester.of("image-ocr").producing((file, digests) -> {
                throw new IllegalStateException("still broken");
            });
            registry.register(ocr);

            for (int i = 0; i < MAX_ATTEMPTS + 2; i++) {
                coordinator.processFile(PHOTO);
            }

            assertThat(ocr.digestCalls).isEqualTo(MAX_ATTEMPTS);
            assertThat(row("image-ocr").attempts()).isEqualTo(MAX_ATTEMPTS);
            assertThat(row("image-ocr").status()).isEqualTo(DigestStatus.FAILED);
        }

        @Test
        @DisplayName("A file locked by another worker is not processed")
        void shouldRespectLock() {
            lockRepository.owners.put(PHOTO, "other-worker");
            TestDigester ocr = TestDigester.of("image-ocr");
            registry.register(ocr);

            FileDigestSummary summary = coordinator.processFile(PHOTO);

            assertThat(summary.locked()).isTrue();
            assertThat(ocr.digestCalls).isZero();
            assertThat(lockRepository.owners).containsEntry(PHOTO, "other-worker");
        }

        @Test
        @DisplayName("A reset requested while another worker holds the lock leaves the rows untouched")
        void shouldNotResetLockedFile() {
            TestDigester ocr = TestDigester.of("image-ocr")
                .producing((file, digests) -> List.of(DigestInput.completed("image-ocr", "old text")));
            registry.register(ocr);
            coordinator.processFile(PHOTO);
            lockRepository.owners.put(PHOTO, "other-worker");

            FileDigestSummary summary = coordinator.processFile(PHOTO, true);

            assertThat(summary.locked()).isTrue();
            assertThat(row("image-ocr").status()).isEqualTo(DigestStatus.COMPLETED);
            assertThat(row("image-ocr").content()).isEqualTo("old text");
            assertThat(ocr.digestCalls).isEqualTo(1);
        }

        @Test
        @DisplayName("Placeholders are not seeded while another worker holds the lock")
        void shouldNotSeedLockedFile() {
            digestRepository.upsert(Digest.placeholder(PHOTO, "legacy-digester", now()));
            registry.register(TestDigester.of("tags"));
            lockRepository.owners.put(PHOTO, "other-worker");

            assertThat(coordinator.ensureDigestPlaceholders(PHOTO)).isZero();

            assertThat(Digests.find(digestRepository.findByFilePath(PHOTO), "tags")).isEmpty();
            assertThat(row("legacy-digester").status()).isEqualTo(DigestStatus.TODO);
        }

        @Test
        @DisplayName("The lock is refreshed before every digester of a long pass")
        void shouldHeartbeatLock() {
            List<OffsetDateTime> lockTimes = new ArrayList<>();
            registry.initialize(List.of(
                TestDigester.of("image-ocr").producing((file, digests) -> {
                    lockTimes.add(lockRepository.lockedAt.get(PHOTO));
                    clock.advance(Duration.ofMinutes(20));
                    return List.of(DigestInput.completed("image-ocr", "text"));
                }),
                TestDigester.of("tags").producing((file, digests) -> {
                    lockTimes.add(lockRepository.lockedAt.get(PHOTO));
                    return List.of(DigestInput.completed("tags", "{}"));
                })));
            OffsetDateTime start = now();

            coordinator.processFile(PHOTO);

            assertThat(lockTimes).containsExactly(start, start.plusMinutes(20));
        }

        @Test
        @DisplayName("A pass whose lock was swept and taken over stops before the next digester")
        void shouldAbandonPassWhenLockLost() {
            TestDigester tags = TestDigester.of("tags");
            registry.initialize(List.of(
                TestDigester.of("image-ocr").producing((file, digests) -> {
                    lockRepository.owners.put(PHOTO, "other-worker");
                    return List.of(DigestInput.completed("image-ocr", "text"));
                }),
                tags));

            FileDigestSummary summary = coordinator.processFile(PHOTO);

            assertThat(summary.processed()).isEqualTo(1);
            assertThat(tags.digestCalls).isZero();
            assertThat(row("tags").status()).isEqualTo(DigestStatus.TODO);
            assertThat(lockRepository.owners).containsEntry(PHOTO, "other-worker");
        }

        @Test
        @DisplayName("The lock is released even when the pass throws")
        void shouldReleaseLockOnError() {
            registry.register(TestDigester.of("image-ocr"));

            assertThatThrownBy(() -> coordinator.processFile("missing.txt"))
                .isInstanceOf(EntityNotFoundException.class);
            assertThat(lockRepository.owners).isEmpty();
        }
    }

    @Nested
    @DisplayName("Reprocessing")
    class Reprocessing {

        @Test
        @DisplayName("A newer upstream digest cascades into downstream digesters")
        void shouldCascadeFromUpstream() {
            boolean[] sourceChanged = {false};
            TestDigester source = TestDigester.of("url-crawl-content")
                .producing((file, digests) -> {
                    sourceChanged[0] = false;
                    return List.of(DigestInput.completed("url-crawl-content", "v" + clock.instant()));
                })
                .reprocessWhen((file, digests) -> sourceChanged[0]);
            TestDigester tags = TestDigester.of("tags")
                .producing((file, digests) -> List.of(DigestInput.completed("tags", "{\"tags\":[]}")))
                .reprocessWhen((file, digests) ->
                    Digests.upstreamChanged(file, digests, "tags", List.of("url-crawl-content"), false));
            registry.initialize(List.of(source, tags));

            coordinator.processFile(PHOTO);
            clock.advance(Duration.ofMinutes(5));
            coordinator.processFile(PHOTO);
            assertThat(tags.digestCalls).isEqualTo(1);

            sourceChanged[0] = true;
            clock.advance(Duration.ofMinutes(5));
            coordinator.processFile(PHOTO);

            assertThat(source.digestCalls).isEqualTo(2);
            assertThat(tags.digestCalls).isEqualTo(2);
            assertThat(row("tags").updatedAt()).isEqualTo(now());

            clock.advance(Duration.ofMinutes(5));
            coordinator.processFile(PHOTO);
            assertThat(tags.digestCalls).isEqualTo(2);
        }

        @Test
        @DisplayName("A failing reprocess check is treated as no change")
        void shouldIgnoreFailingReprocessCheck() {
            TestDigester ocr = TestDigester.of("image-ocr")
                .producing((file, digests) -> List.of(DigestInput.completed("image-ocr", "text")))
                .reprocessWhen((file, digests) -> {
                    throw new IllegalStateException("bad check");
                });
            registry.register(ocr);

            coordinator.processFile(PHOTO);
            coordinator.processFile(PHOTO);

            assertThat(ocr.digestCalls).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Placeholders and resets")
    class Placeholders {

        @Test
        @DisplayName("Creates a todo row per registered output exactly once")
        void shouldCreatePlaceholders() {
            registry.initialize(List.of(
                TestDigester.of("url-crawl").withOutputs("url-crawl-content", "url-crawl-screenshot"),
                TestDigester.of("tags")));

            assertThat(coordinator.ensureDigestPlaceholders(PHOTO)).isEqualTo(3);
            assertThat(coordinator.ensureDigestPlaceholders(PHOTO)).isZero();
            assertThat(digestRepository.findByFilePath(PHOTO))
                .extracting(Digest::status)
                .containsOnly(DigestStatus.TODO);
        }

        @Test
        @DisplayName("Rows of digesters that are no longer registered are retired")
        void shouldRetireUnregisteredRows() {
            digestRepository.upsert(Digest.placeholder(PHOTO, "legacy-digester", now()));
            registry.register(TestDigester.of("tags"));

            coordinator.ensureDigestPlaceholders(PHOTO);

            assertThat(row("legacy-digester").status()).isEqualTo(DigestStatus.SKIPPED);
            assertThat(row("legacy-digester").error()).isEqualTo(DigestCoordinator.NO_LONGER_REGISTERED);
        }

        @Test
        @DisplayName("A reset pass redoes every digest of the file")
        void shouldResetDigests() {
            List<DigestStatus> seen = new ArrayList<>();
            TestDigester ocr = TestDigester.of("image-ocr")
                .producing((file, digests) -> {
                    seen.add(Digests.find(digests, "image-ocr").map(Digest::status).orElse(null));
                    return List.of(DigestInput.completed("image-ocr", "text " + seen.size()));
                });
            registry.register(ocr);
            coordinator.processFile(PHOTO);
            coordinator.processFile(PHOTO);

            FileDigestSummary summary = coordinator.processFile(PHOTO, true);

            assertThat(summary.processed()).isEqualTo(1);
            assertThat(ocr.digestCalls).isEqualTo(2);
            assertThat(seen).containsExactly(DigestStatus.TODO, DigestStatus.TODO);
            assertThat(row("image-ocr").content()).isEqualTo("text 2");
            assertThat(lockRepository.owners).isEmpty();
        }

        @Test
        @DisplayName("A pass seeds placeholders for outputs its digesters never wrote")
        void shouldSeedPlaceholdersDuringPass() {
            registry.register(TestDigester.of("url-crawl")
                .withOutputs("url-crawl-content", "url-crawl-screenshot")
                .producing((file, digests) -> {
                    assertThat(digests).extracting(Digest::digester)
                        .containsExactlyInAnyOrder("url-crawl-content", "url-crawl-screenshot");
                    return List.of(
                        DigestInput.completed("url-crawl-content", "{}"),
                        DigestInput.completed("url-crawl-screenshot", null));
                }));

            assertThat(coordinator.processFile(PHOTO).processed()).isEqualTo(1);
        }
    }

    static final class TestDigester implements Digester {

        private final String name;
        private List<String> outputs;
        private BiPredicate<FileRecord, List<Digest>> applicable = (file, digests) -> true;
        private BiFunction<FileRecord, List<Digest>, List<DigestInput>> producer;
        private BiPredicate<FileRecord, List<Digest>> reprocess = (file, digests) -> false;
        int digestCalls;

        private TestDigester(String name) {
            this.name = name;
            this.outputs = List.of(name);
            this.producer = (file, digests) -> List.of(DigestInput.completed(name, null));
        }

        static TestDigester of(String name) {
            return new TestDigester(name);
        }

        TestDigester withOutputs(String... types) {
            this.outputs = List.of(types);
            return this;
        }

        TestDigester applicableWhen(BiPredicate<FileRecord, List<Digest>> predicate) {
            this.applicable = predicate;
            return this;
        }

        TestDigester producing(BiFunction<FileRecord, List<Digest>, List<DigestInput>> function) {
            this.producer = function;
            return this;
        }

        TestDigester reprocessWhen(BiPredicate<FileRecord, List<Digest>> predicate) {
            this.reprocess = predicate;
            return this;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<String> outputs() {
            return outputs;
        }

        @Override
        public boolean canDigest(FileRecord file, List<Digest> existingDigests) {
            return applicable.test(file, existingDigests);
        }

        @Override
        public List<DigestInput> digest(FileRecord file, List<Digest> existingDigests) {
            digestCalls++;
            return producer.apply(file, existingDigests);
        }

        @Override
        public boolean shouldReprocessCompleted(FileRecord file, List<Digest> existingDigests) {
            return reprocess.test(file, existingDigests);
        }
    }

    static final class MutableClock extends Clock {

        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }

    static final class InMemoryDigestRepository implements DigestRepository {

        private final Map<String, Digest> rows = new LinkedHashMap<>();

        @Override
        public List<Digest> findByFilePath(String filePath) {
            return rows.values().stream().filter(d -> d.filePath().equals(filePath)).toList();
        }

        @Override
        public void upsert(Digest digest) {
            rows.put(digest.id(), digest);
        }

        @Override
        public int insertMissing(String filePath, Collection<String> digesters, OffsetDateTime now) {
            int created = 0;
            for (String digester : digesters) {
                if (rows.putIfAbsent(Digest.idFor(filePath, digester), Digest.placeholder(filePath, digester, now)) == null) {
                    created++;
                }
            }
            return created;
        }

        @Override
        public int resetAllForFile(String filePath, OffsetDateTime now) {
            List<Digest> digests = findByFilePath(filePath);
            digests.forEach(d -> rows.put(d.id(), new Digest(d.id(), filePath, d.digester(), DigestStatus.TODO,
                null, null, null, 0, d.createdAt(), now)));
            return digests.size();
        }

        @Override
        public int resetStale(OffsetDateTime cutoff, OffsetDateTime now) {
            return 0;
        }

        @Override
        public List<DigesterStats> countByDigester() {
            return List.of();
        }
    }

    static final class InMemoryFileRepository implements FileRepository {

        private final Map<String, FileRecord> files = new HashMap<>();

        void add(FileRecord file) {
            files.put(file.path(), file);
        }

        @Override
        public Optional<FileRecord> findByPath(String path) {
            return Optional.ofNullable(files.get(path));
        }

        @Override
        public List<String> findPathsNeedingDigestion(Collection<String> digestTypes, Collection<String> excludedPrefixes,
                                                      int maxAttempts, int limit) {
            return List.of();
        }
    }

    static final class InMemoryArchiveRepository implements ArchiveRepository {

        private final Map<String, byte[]> archives = new HashMap<>();

        @Override
        public void save(String name, byte[] data) {
            archives.put(name, data);
        }

        @Override
        public Optional<byte[]> findByName(String name) {
            return Optional.ofNullable(archives.get(name));
        }
    }

    static final class InMemoryLockRepository implements ProcessingLockRepository {

        final Map<String, String> owners = new HashMap<>();
        final Map<String, OffsetDateTime> lockedAt = new HashMap<>();

        @Override
        public boolean tryAcquire(String filePath, String owner, OffsetDateTime now) {
            if (owners.putIfAbsent(filePath, owner) != null) {
                return false;
            }
            lockedAt.put(filePath, now);
            return true;
        }

        @Override
        public void release(String filePath, String owner) {
            if (owners.remove(filePath, owner)) {
                lockedAt.remove(filePath);
            }
        }

        @Override
        public boolean refresh(String filePath, String owner, OffsetDateTime now) {
            if (!owner.equals(owners.get(filePath))) {
                return false;
            }
            lockedAt.put(filePath, now);
            return true;
        }

        @Override
        public int deleteOlderThan(OffsetDateTime cutoff) {
            return 0;
        }
    }
}
