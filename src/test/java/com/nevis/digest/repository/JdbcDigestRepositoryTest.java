package com.nevis.digest.repository;

import com.nevis.digest.model.Digest;
import com.nevis.digest.model.DigestStatus;
import com.nevis.digest.model.DigesterStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcDigestRepositoryTest extends BaseIntegrationTest {

    private static final String PATH = "photos/cat.jpg";
    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-03-01T12:00:00Z");

    @Autowired
    private DigestRepository digestRepository;

    @Autowired
    private ArchiveRepository archiveRepository;

    private Digest find(String digester) {
        return digestRepository.findByFilePath(PATH).stream()
            .filter(d -> d.digester().equals(digester))
            .findFirst()
            .orElseThrow();
    }

    @Test
    @DisplayName("Placeholders are created once per digest type")
    void shouldInsertMissingOnce() {
        assertThat(digestRepository.insertMissing(PATH, List.of("image-ocr", "tags"), T0)).isEqualTo(2);
        assertThat(digestRepository.insertMissing(PATH, List.of("image-ocr", "tags", "search-keyword"), T0))
            .isEqualTo(1);

        assertThat(digestRepository.findByFilePath(PATH))
            .extracting(Digest::status)
            .containsOnly(DigestStatus.TODO)
            .hasSize(3);
    }

    @Test
    @DisplayName("Upsert replaces the row but keeps its creation time")
    void shouldUpsertKeepingCreatedAt() {
        digestRepository.upsert(Digest.placeholder(PATH, "image-ocr", T0));
        digestRepository.upsert(new Digest(Digest.idFor(PATH, "image-ocr"), PATH, "image-ocr",
            DigestStatus.COMPLETED, "meow", null, null, 0, T0.plusHours(1), T0.plusHours(1)));

        Digest stored = find("image-ocr");
        assertThat(stored.status()).isEqualTo(DigestStatus.COMPLETED);
        assertThat(stored.content()).isEqualTo("meow");
        assertThat(stored.createdAt()).isAtSameInstantAs(T0);
        assertThat(stored.updatedAt()).isAtSameInstantAs(T0.plusHours(1));
    }

    @Test
    @DisplayName("Reset clears every digest of the file")
    void shouldResetAllForFile() {
        digestRepository.upsert(new Digest(Digest.idFor(PATH, "tags"), PATH, "tags",
            DigestStatus.FAILED, "x", "archive", "boom", 3, T0, T0));
        digestRepository.upsert(Digest.placeholder("other.md", "tags", T0));

        assertThat(digestRepository.resetAllForFile(PATH, T0.plusMinutes(1))).isEqualTo(1);

        Digest reset = find("tags");
        assertThat(reset.status()).isEqualTo(DigestStatus.TODO);
        assertThat(reset.attempts()).isZero();
        assertThat(reset.content()).isNull();
        assertThat(reset.archiveName()).isNull();
        assertThat(reset.error()).isNull();
    }

    @Test
    @DisplayName("Only in-progress rows older than the cutoff are reset as stale")
    void shouldResetStale() {
        digestRepository.upsert(new Digest(Digest.idFor(PATH, "image-ocr"), PATH, "image-ocr",
            DigestStatus.IN_PROGRESS, null, null, null, 0, T0, T0));
        digestRepository.upsert(new Digest(Digest.idFor(PATH, "tags"), PATH, "tags",
            DigestStatus.IN_PROGRESS, null, null, null, 0, T0, T0.plusMinutes(30)));

        int reset = digestRepository.resetStale(T0.plusMinutes(10), T0.plusMinutes(40));

        assertThat(reset).isEqualTo(1);
        assertThat(find("image-ocr").status()).isEqualTo(DigestStatus.TODO);
        assertThat(find("tags").status()).isEqualTo(DigestStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("Counts rows per digester and status")
    void shouldCountByDigester() {
        digestRepository.upsert(Digest.placeholder(PATH, "tags", T0));
        digestRepository.upsert(new Digest(Digest.idFor("b.md", "tags"), "b.md", "tags",
            DigestStatus.COMPLETED, "{}", null, null, 0, T0, T0));
        digestRepository.upsert(new Digest(Digest.idFor(PATH, "image-ocr"), PATH, "image-ocr",
            DigestStatus.SKIPPED, null, null, "Not applicable", 0, T0, T0));

        assertThat(digestRepository.countByDigester()).containsExactly(
            new DigesterStats("image-ocr", 0, 0, 0, 0, 1),
            new DigesterStats("tags", 1, 0, 1, 0, 0));
    }

    @Test
    @DisplayName("Archives are stored and read back by name")
    void shouldStoreArchive() {
        archiveRepository.save("photos/cat.jpg/shot.png", new byte[]{1, 2, 3});
        archiveRepository.save("photos/cat.jpg/shot.png", new byte[]{4, 5});

        assertThat(archiveRepository.findByName("photos/cat.jpg/shot.png")).hasValueSatisfying(
            data -> assertThat(data).containsExactly(4, 5));
        assertThat(archiveRepository.findByName("missing")).isEmpty();
    }
}
