package com.purchasingpower.codelod.staleness;

import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.core.EntityIdentity;
import com.purchasingpower.codelod.core.Freshness;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.TestEntities;
import com.purchasingpower.codelod.index.DescriptionRecord;
import com.purchasingpower.codelod.index.HashIndex;
import com.purchasingpower.codelod.staleness.impl.StalenessTrackerImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against the test profile, which caps fingerprint history at three entries.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Staleness Tracker Tests")
class StalenessTrackerTest {

    private static final String PATH = "src/auth.py";
    private static final EntityIdentity AUTH = TestEntities.functionIdentity("authenticate_user", PATH);

    private static final String V1 = """
        def authenticate_user(name, password):
            return check(name, password)
        """;
    private static final String V1_REFORMATTED = """
        def authenticate_user(name,   password):
            # delegate to the credential store
            return check(name,password)
        """;
    private static final String V2 = """
        def authenticate_user(name, password):
            return check(name, hash(password))
        """;

    @Autowired
    private StalenessTracker tracker;

    @Autowired
    private HashIndex index;

    @Autowired
    private CodeLodProperties properties;

    @BeforeEach
    void setUp() {
        index.clear();
    }

    @Test
    @DisplayName("Reformatting keeps a description fresh, a behavior change needs a new one")
    void authenticateUserScenario() {
        // Given: a fresh description for the original code
        String aaa = TestEntities.fingerprint(V1);
        tracker.recordGenerated(AUTH, aaa, "Authenticates user credentials.");

        // When: whitespace and comments change
        String reformatted = TestEntities.fingerprint(V1_REFORMATTED);

        // Then
        assertThat(reformatted).isEqualTo(aaa);
        assertThat(tracker.check(AUTH, reformatted)).isEqualTo(Freshness.FRESH);

        // When: behavior changes
        String bbb = TestEntities.fingerprint(V2);
        assertThat(tracker.check(AUTH, bbb)).isEqualTo(Freshness.UNKNOWN);
        tracker.recordGenerated(AUTH, bbb, "Authenticates user credentials against hashed passwords.");

        // Then: the new record carries the old fingerprint in its history
        DescriptionRecord active = index.get(bbb).orElseThrow();
        assertThat(active.getFingerprintHistory()).containsExactly(aaa);
        assertThat(index.currentFingerprint(AUTH)).contains(bbb);
    }

    @Test
    @DisplayName("Reverting to earlier content reuses its description")
    void revertReuse() {
        String f1 = TestEntities.fingerprint(V1);
        String f2 = TestEntities.fingerprint(V2);
        tracker.recordGenerated(AUTH, f1, "D1");
        tracker.recordGenerated(AUTH, f2, "D2");

        assertThat(tracker.check(AUTH, f1)).isEqualTo(Freshness.FRESH);
        assertThat(tracker.resolveDescription(AUTH, f1)).contains("D1");

        tracker.adopt(AUTH, f1);
        assertThat(index.currentFingerprint(AUTH)).contains(f1);
        assertThat(index.get(f1).orElseThrow().getFingerprintHistory()).containsExactly(f2);
    }

    @Test
    @DisplayName("A revert is recognized from history alone when the old record is gone")
    void revertFromHistoryOnly() {
        String f1 = TestEntities.fingerprint(V1);
        String f2 = TestEntities.fingerprint(V2);
        tracker.recordGenerated(AUTH, f1, "D1");
        tracker.recordGenerated(AUTH, f2, "D2");
        index.delete(f1);

        RevertMatch match = tracker.detectRevert(AUTH, f1).orElseThrow();

        assertThat(match.getOwnerFingerprint()).isEqualTo(f2);
        assertThat(match.getHistoryPosition()).isZero();
        assertThat(tracker.check(AUTH, f1)).isEqualTo(Freshness.FRESH);

        tracker.adopt(AUTH, f1);
        assertThat(index.get(f1)).map(DescriptionRecord::getDescription).contains("D2");
        assertThat(index.currentFingerprint(AUTH)).contains(f1);
    }

    @Test
    @DisplayName("History keeps the most recent fingerprints and evicts the oldest first")
    void historyBound() {
        // Given: five successive versions with a history cap of three
        String[] versions = new String[5];
        for (int i = 0; i < versions.length; i++) {
            versions[i] = TestEntities.fingerprint("def authenticate_user():\n    return " + i + "\n");
            tracker.recordGenerated(AUTH, versions[i], "Version " + i);
        }

        // Then
        DescriptionRecord latest = index.get(versions[4]).orElseThrow();
        assertThat(latest.getFingerprintHistory()).containsExactly(versions[3], versions[2], versions[1]);
        assertThat(tracker.detectRevert(AUTH, versions[1])).isPresent();
        assertThat(tracker.detectRevert(AUTH, versions[0])).isEmpty();
    }

    @Test
    @DisplayName("A stale owner record blocks revert reuse")
    void staleOwnerBlocksRevert() {
        String f1 = TestEntities.fingerprint(V1);
        String f2 = TestEntities.fingerprint(V2);
        tracker.recordGenerated(AUTH, f1, "D1");
        tracker.recordGenerated(AUTH, f2, "D2");
        index.delete(f1);
        tracker.invalidate(f2);

        assertThat(tracker.detectRevert(AUTH, f1)).isEmpty();
        assertThat(tracker.check(AUTH, f1)).isEqualTo(Freshness.STALE);
    }

    @Test
    @DisplayName("Explicit invalidation makes a record stale until marked fresh or regenerated")
    void invalidateAndMarkFresh() {
        String f1 = TestEntities.fingerprint(V1);
        tracker.recordGenerated(AUTH, f1, "D1");

        assertThat(tracker.invalidate(f1)).isTrue();
        assertThat(tracker.check(AUTH, f1)).isEqualTo(Freshness.STALE);
        assertThat(tracker.listStale()).extracting(DescriptionRecord::getFingerprint).containsExactly(f1);
        assertThat(tracker.resolveDescription(AUTH, f1)).isEmpty();

        assertThat(tracker.markFresh(f1)).isTrue();
        assertThat(tracker.check(AUTH, f1)).isEqualTo(Freshness.FRESH);

        tracker.invalidate(f1);
        tracker.recordGenerated(AUTH, f1, "D1 again");
        assertThat(tracker.check(AUTH, f1)).isEqualTo(Freshness.FRESH);
        assertThat(tracker.invalidate(TestEntities.fingerprint("def nothing(): pass"))).isFalse();
    }

    @Test
    @DisplayName("Batch check accounts for every entity")
    void batchAccounting() {
        // Given: one fresh, one stale and one never described entity
        ParsedEntity fresh = TestEntities.function("login", PATH, "def login():\n    return 1\n");
        ParsedEntity stale = TestEntities.function("logout", PATH, "def logout():\n    return 2\n");
        ParsedEntity unknown = TestEntities.function("refresh", PATH, "def refresh():\n    return 3\n");
        tracker.recordGenerated(fresh.identity(), fresh.getFingerprint(), "Logs in.");
        tracker.recordGenerated(stale.identity(), stale.getFingerprint(), "Logs out.");
        tracker.invalidate(stale.getFingerprint());

        // When
        FreshnessReport report = tracker.checkBatch(List.of(fresh, stale, unknown));

        // Then
        assertThat(report.getTotal()).isEqualTo(3);
        assertThat(report.getFresh()).isEqualTo(1);
        assertThat(report.getStale()).isEqualTo(2);
        assertThat(report.getUnknown()).isEqualTo(1);
        assertThat(report.getEntries()).hasSize(2);
        assertThat(report.hasStale()).isTrue();

        StaleEntry unknownEntry = report.getEntries().stream()
            .filter(StaleEntry::isUnknown).findFirst().orElseThrow();
        assertThat(unknownEntry.getName()).isEqualTo("refresh");
        assertThat(unknownEntry.getStoredFingerprint()).isNull();
        assertThat(unknownEntry.getFreshness()).isEqualTo(Freshness.UNKNOWN);
    }

    @Test
    @DisplayName("An edited entity whose last description was invalidated reports the stored fingerprint")
    void editedAfterInvalidationIsStale() {
        String f1 = TestEntities.fingerprint(V1);
        String f2 = TestEntities.fingerprint(V2);
        tracker.recordGenerated(AUTH, f1, "D1");
        tracker.invalidate(f1);

        ParsedEntity edited = TestEntities.function("authenticate_user", PATH, V2);
        FreshnessReport report = tracker.checkBatch(List.of(edited));

        assertThat(edited.getFingerprint()).isEqualTo(f2);
        assertThat(report.getEntries()).singleElement().satisfies(entry -> {
            assertThat(entry.getFreshness()).isEqualTo(Freshness.STALE);
            assertThat(entry.getStoredFingerprint()).isEqualTo(f1);
        });
        assertThat(report.getUnknown()).isZero();
    }

    @Test
    @DisplayName("A newly described identity starts with its own empty history")
    void newIdentityDoesNotInheritHistory() {
        // Given: one identity moved from V1 to V2
        EntityIdentity verify = TestEntities.functionIdentity("verify_user", PATH);
        String f1 = TestEntities.fingerprint(V1);
        String f2 = TestEntities.fingerprint(V2);
        tracker.recordGenerated(AUTH, f1, "D1");
        tracker.recordGenerated(AUTH, f2, "D2");
        index.delete(f1);

        // When: another identity with the same content is described for the first time
        tracker.recordGenerated(verify, f2, "Verifies user credentials.");

        // Then: V1 was never part of its past
        assertThat(index.get(f2).orElseThrow().getFingerprintHistory()).isEmpty();
        assertThat(tracker.detectRevert(verify, f1)).isEmpty();
        assertThat(tracker.check(verify, f1)).isEqualTo(Freshness.UNKNOWN);
    }

    @Test
    @DisplayName("Adopting an existing record rewrites its history and the identity pointer in one write")
    void adoptWritesOnce() {
        // Given
        String f1 = TestEntities.fingerprint(V1);
        String f2 = TestEntities.fingerprint(V2);
        tracker.recordGenerated(AUTH, f1, "D1");
        tracker.recordGenerated(AUTH, f2, "D2");
        ObservedHashIndex observed = new ObservedHashIndex(index);

        // When
        new StalenessTrackerImpl(observed, properties).adopt(AUTH, f1);

        // Then
        assertThat(observed.getWrites()).containsExactly("record");
        assertThat(index.currentFingerprint(AUTH)).contains(f1);
        DescriptionRecord adopted = index.get(f1).orElseThrow();
        assertThat(adopted.getFingerprintHistory()).containsExactly(f2);
        assertThat(adopted.isStale()).isFalse();
    }

    @Test
    @DisplayName("An interrupted batch check stops between entities and leaves records intact")
    void interruptedBatchCheck() {
        // Given
        ParsedEntity login = TestEntities.function("login", PATH, "def login():\n    return 1\n");
        ParsedEntity logout = TestEntities.function("logout", PATH, "def logout():\n    return 2\n");
        tracker.recordGenerated(login.identity(), login.getFingerprint(), "Logs in.");
        ObservedHashIndex observed = new ObservedHashIndex(index);
        StalenessTracker interrupting = new StalenessTrackerImpl(observed, properties);

        // When: the thread is interrupted while the first entity is checked
        observed.interruptAfterReads(1);
        try {
            assertThatThrownBy(() -> interrupting.checkBatch(List.of(login, logout)))
                .isInstanceOf(CancellationException.class)
                .hasMessageContaining("after 1 of 2");
        } finally {
            Thread.interrupted();
        }

        // Then
        assertThat(observed.getReads()).isEqualTo(1);
        assertThat(tracker.check(login.identity(), login.getFingerprint())).isEqualTo(Freshness.FRESH);
        assertThat(tracker.checkBatch(List.of(login, logout)).getTotal()).isEqualTo(2);
    }

    @Test
    @DisplayName("Recording rejects malformed fingerprints")
    void recordGeneratedValidatesInput() {
        assertThatThrownBy(() -> tracker.recordGenerated(AUTH, "sha256:xyz", "D"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(index.count()).isZero();
    }
}
