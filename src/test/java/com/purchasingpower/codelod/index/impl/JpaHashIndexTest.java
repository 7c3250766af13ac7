package com.purchasingpower.codelod.index.impl;

import com.purchasingpower.codelod.core.EntityIdentity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.core.TestEntities;
import com.purchasingpower.codelod.index.DescriptionRecord;
import com.purchasingpower.codelod.index.HashIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("JPA Hash Index Tests")
class JpaHashIndexTest {

    private static final String FP_A = TestEntities.fingerprint("def a():\n    return 1\n");
    private static final String FP_B = TestEntities.fingerprint("def b():\n    return 2\n");

    @Autowired
    private HashIndex index;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        index.clear();
    }

    @Test
    @DisplayName("set then get returns the stored record")
    void setAndGet() {
        // When
        index.set(FP_A, "Returns one.", false, List.of(FP_B));

        // Then
        DescriptionRecord record = index.get(FP_A).orElseThrow();
        assertThat(record.getDescription()).isEqualTo("Returns one.");
        assertThat(record.isStale()).isFalse();
        assertThat(record.getFingerprintHistory()).containsExactly(FP_B);
        assertThat(record.getCreatedAt()).isNotNull();
        assertThat(index.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Replacing a record keeps its creation time")
    void set_replaceKeepsCreatedAt() {
        index.set(FP_A, "First.");
        DescriptionRecord first = index.get(FP_A).orElseThrow();

        index.set(FP_A, "Second.", true, List.of());

        DescriptionRecord second = index.get(FP_A).orElseThrow();
        assertThat(second.getDescription()).isEqualTo("Second.");
        assertThat(second.isStale()).isTrue();
        assertThat(second.getCreatedAt()).isEqualTo(first.getCreatedAt());
        assertThat(index.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown fingerprints read as absent and cannot be marked")
    void unknownFingerprint() {
        assertThat(index.get(FP_A)).isEmpty();
        assertThat(index.markStale(FP_A)).isFalse();
        assertThat(index.markFresh(FP_A)).isFalse();
    }

    @Test
    @DisplayName("markStale and markFresh flip the flag and drive listStale")
    void markStaleAndFresh() {
        index.set(FP_A, "A.");
        index.set(FP_B, "B.");

        assertThat(index.markStale(FP_B)).isTrue();
        assertThat(index.listStale()).extracting(DescriptionRecord::getFingerprint).containsExactly(FP_B);

        assertThat(index.markFresh(FP_B)).isTrue();
        assertThat(index.listStale()).isEmpty();
        assertThat(index.listAll()).hasSize(2);
    }

    @Test
    @DisplayName("record writes the description and moves the identity pointer")
    void recordPointsIdentity() {
        EntityIdentity identity = TestEntities.functionIdentity("a", "src/a.py");

        index.record(identity, FP_A, "A.", List.of());
        assertThat(index.currentFingerprint(identity)).contains(FP_A);

        index.record(identity, FP_B, "B.", List.of(FP_A));
        assertThat(index.currentFingerprint(identity)).contains(FP_B);
        assertThat(index.get(FP_A)).isPresent();
    }

    @Test
    @DisplayName("Identities differing only in scope have separate pointers")
    void pointersAreKeyedByFullIdentity() {
        EntityIdentity function = new EntityIdentity(Scope.FUNCTION, "a", "src/a.py");
        EntityIdentity module = new EntityIdentity(Scope.MODULE, "a", "src/a.py");
        index.set(FP_A, "A.");
        index.set(FP_B, "B.");

        index.point(function, FP_A);
        index.point(module, FP_B);

        assertThat(index.currentFingerprint(function)).contains(FP_A);
        assertThat(index.currentFingerprint(module)).contains(FP_B);
    }

    @Test
    @DisplayName("A record with an unreadable history is treated as absent")
    void corruptHistoryReadsAsAbsent() {
        index.set(FP_A, "A.");
        index.set(FP_B, "B.");
        jdbcTemplate.update("UPDATE descriptions SET fingerprint_history = ? WHERE fingerprint = ?", "{not json", FP_A);

        Optional<DescriptionRecord> corrupt = index.get(FP_A);

        assertThat(corrupt).isEmpty();
        assertThat(index.listAll()).extracting(DescriptionRecord::getFingerprint).containsExactly(FP_B);
    }

    @Test
    @DisplayName("Invalid fingerprints are rejected before touching storage")
    void rejectsInvalidFingerprint() {
        assertThatThrownBy(() -> index.set("md5:abc", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThat(index.count()).isZero();
    }

    @Test
    @DisplayName("clear removes records and pointers")
    void clearRemovesEverything() {
        EntityIdentity identity = TestEntities.functionIdentity("a", "src/a.py");
        index.record(identity, FP_A, "A.", List.of());

        index.clear();

        assertThat(index.count()).isZero();
        assertThat(index.currentFingerprint(identity)).isEmpty();
    }

    @Test
    @DisplayName("Should flag only transient storage failures as retryable")
    void shouldClassifyRetryableFailures() {
        // Locking, disk and connection failures may clear up on a second attempt
        assertThat(JpaHashIndex.isRetryable(new QueryTimeoutException("lock wait"))).isTrue();
        assertThat(JpaHashIndex.isRetryable(new DataAccessResourceFailureException("disk I/O error"))).isTrue();
        assertThat(JpaHashIndex.isRetryable(new CannotCreateTransactionException("connection refused"))).isTrue();

        // Integrity and usage errors will fail the same way again
        assertThat(JpaHashIndex.isRetryable(new DataIntegrityViolationException("duplicate key"))).isFalse();
        assertThat(JpaHashIndex.isRetryable(new InvalidDataAccessApiUsageException("bad call"))).isFalse();
    }
}
