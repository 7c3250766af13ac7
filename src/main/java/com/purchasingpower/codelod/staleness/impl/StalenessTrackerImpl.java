package com.purchasingpower.codelod.staleness.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.core.EntityIdentity;
import com.purchasingpower.codelod.core.Freshness;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.fingerprint.Fingerprints;
import com.purchasingpower.codelod.index.DescriptionRecord;
import com.purchasingpower.codelod.index.HashIndex;
import com.purchasingpower.codelod.staleness.FreshnessReport;
import com.purchasingpower.codelod.staleness.RevertMatch;
import com.purchasingpower.codelod.staleness.StaleEntry;
import com.purchasingpower.codelod.staleness.StalenessTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

@Slf4j
@Service
public class StalenessTrackerImpl implements StalenessTracker {

    private final HashIndex index;
    private final int historyLimit;

    public StalenessTrackerImpl(HashIndex index, CodeLodProperties properties) {
        this.index = index;
        this.historyLimit = properties.getHistoryLimit();
    }

    @Override
    public Freshness check(EntityIdentity identity, String currentFingerprint) {
        return classify(identity, currentFingerprint).freshness();
    }

    @Override
    public FreshnessReport checkBatch(List<ParsedEntity> entities) {
        int fresh = 0;
        int unknown = 0;
        List<StaleEntry> entries = new ArrayList<>();

        for (ParsedEntity entity : entities) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Freshness check interrupted after "
                    + (fresh + entries.size()) + " of " + entities.size() + " entities");
            }
            Classification result = classify(entity.identity(), entity.getFingerprint());
            if (result.freshness() == Freshness.FRESH) {
                fresh++;
                continue;
            }
            if (result.storedFingerprint() == null) {
                unknown++;
            }
            entries.add(StaleEntry.builder()
                .scope(entity.getScope())
                .name(entity.getName())
                .path(entity.getLocation().path())
                .currentFingerprint(entity.getFingerprint())
                .storedFingerprint(result.storedFingerprint())
                .previousFingerprint(result.previousFingerprint())
                .freshness(result.freshness())
                .build());
        }

        log.info("📊 Checked {} entities: {} fresh, {} need generation ({} unknown)",
            entities.size(), fresh, entries.size(), unknown);

        return FreshnessReport.builder()
            .total(entities.size())
            .fresh(fresh)
            .stale(entries.size())
            .unknown(unknown)
            .entries(List.copyOf(entries))
            .build();
    }

    @Override
    public void recordGenerated(EntityIdentity identity, String fingerprint, String description) {
        Preconditions.checkNotNull(identity, "identity is required");
        Preconditions.checkArgument(Fingerprints.isValid(fingerprint), "Invalid fingerprint: %s", fingerprint);
        Preconditions.checkNotNull(description, "description is required");

        String previous = index.currentFingerprint(identity).orElse(null);
        List<String> history;
        if (previous == null) {
            // First description for this identity: nothing of its own to revert to
            history = List.of();
        } else if (previous.equals(fingerprint)) {
            history = index.get(fingerprint)
                .map(DescriptionRecord::getFingerprintHistory)
                .orElse(List.of());
        } else {
            history = supersede(previous, fingerprint);
        }

        index.record(identity, fingerprint, description, history);
        log.info("✅ Recorded description for {} at {} (history: {})",
            identity, Fingerprints.abbreviate(fingerprint), history.size());
    }

    @Override
    public boolean invalidate(String fingerprint) {
        boolean marked = index.markStale(fingerprint);
        if (marked) {
            log.info("Invalidated {}", Fingerprints.abbreviate(fingerprint));
        } else {
            log.warn("⚠️ Nothing to invalidate for {}", Fingerprints.abbreviate(fingerprint));
        }
        return marked;
    }

    @Override
    public boolean markFresh(String fingerprint) {
        return index.markFresh(fingerprint);
    }

    @Override
    public Optional<RevertMatch> detectRevert(EntityIdentity identity, String currentFingerprint) {
        if (currentFingerprint == null) {
            return Optional.empty();
        }
        Optional<String> owner = index.currentFingerprint(identity);
        if (owner.isEmpty() || owner.get().equals(currentFingerprint)) {
            return Optional.empty();
        }
        Optional<DescriptionRecord> ownerRecord = index.get(owner.get());
        if (ownerRecord.isEmpty() || ownerRecord.get().isStale()) {
            return Optional.empty();
        }
        int position = ownerRecord.get().getFingerprintHistory().indexOf(currentFingerprint);
        if (position < 0) {
            return Optional.empty();
        }
        return Optional.of(RevertMatch.builder()
            .fingerprint(currentFingerprint)
            .ownerFingerprint(owner.get())
            .description(ownerRecord.get().getDescription())
            .historyPosition(position)
            .build());
    }

    @Override
    public Optional<String> resolveDescription(EntityIdentity identity, String currentFingerprint) {
        Optional<DescriptionRecord> direct = index.get(currentFingerprint);
        if (direct.isPresent()) {
            return direct.filter(r -> !r.isStale()).map(DescriptionRecord::getDescription);
        }
        return detectRevert(identity, currentFingerprint).map(RevertMatch::getDescription);
    }

    @Override
    public void adopt(EntityIdentity identity, String fingerprint) {
        Optional<String> previous = index.currentFingerprint(identity);
        if (previous.isPresent() && previous.get().equals(fingerprint)) {
            return;
        }

        Optional<DescriptionRecord> existing = index.get(fingerprint);
        if (existing.isPresent()) {
            DescriptionRecord record = existing.get();
            if (previous.isPresent()) {
                index.record(identity, fingerprint, record.getDescription(), record.isStale(),
                    supersede(previous.get(), fingerprint));
            } else {
                index.point(identity, fingerprint);
            }
            log.debug("Adopted existing record {} for {}", Fingerprints.abbreviate(fingerprint), identity);
            return;
        }

        RevertMatch revert = detectRevert(identity, fingerprint).orElseThrow(() -> new IllegalStateException(
            "No description available for " + identity + " at " + Fingerprints.abbreviate(fingerprint)));
        index.record(identity, fingerprint, revert.getDescription(),
            supersede(revert.getOwnerFingerprint(), fingerprint));
        log.info("↩️ Revert detected for {}: reusing description of {}",
            identity, Fingerprints.abbreviate(revert.getOwnerFingerprint()));
    }

    @Override
    public Optional<DescriptionRecord> description(String fingerprint) {
        return index.get(fingerprint);
    }

    @Override
    public List<DescriptionRecord> listStale() {
        return index.listStale();
    }

    private Classification classify(EntityIdentity identity, String currentFingerprint) {
        Preconditions.checkNotNull(identity, "identity is required");

        Optional<DescriptionRecord> direct = index.get(currentFingerprint);
        if (direct.isPresent()) {
            return direct.get().isStale()
                ? new Classification(Freshness.STALE, currentFingerprint, currentFingerprint)
                : new Classification(Freshness.FRESH, currentFingerprint, currentFingerprint);
        }

        if (detectRevert(identity, currentFingerprint).isPresent()) {
            return new Classification(Freshness.FRESH, null, null);
        }

        Optional<String> previous = index.currentFingerprint(identity);
        if (previous.isPresent()) {
            boolean previousStale = index.get(previous.get()).map(DescriptionRecord::isStale).orElse(false);
            if (previousStale) {
                return new Classification(Freshness.STALE, previous.get(), previous.get());
            }
        }
        return new Classification(Freshness.UNKNOWN, null, previous.orElse(null));
    }

    /**
     * History for a record that replaces {@code previous}: the previous fingerprint first,
     * then its own history, without {@code replacement}, capped to the configured limit.
     */
    private List<String> supersede(String previous, String replacement) {
        Set<String> merged = new LinkedHashSet<>();
        merged.add(previous);
        index.get(previous).ifPresent(r -> merged.addAll(r.getFingerprintHistory()));
        merged.remove(replacement);
        return merged.stream().limit(historyLimit).toList();
    }

    private record Classification(Freshness freshness, String storedFingerprint, String previousFingerprint) {
    }
}
