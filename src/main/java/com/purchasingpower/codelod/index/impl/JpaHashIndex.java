package com.purchasingpower.codelod.index.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.codelod.core.EntityIdentity;
import com.purchasingpower.codelod.exception.HashIndexException;
import com.purchasingpower.codelod.fingerprint.Fingerprints;
import com.purchasingpower.codelod.index.DescriptionRecord;
import com.purchasingpower.codelod.index.HashIndex;
import com.purchasingpower.codelod.model.DescriptionRecordEntity;
import com.purchasingpower.codelod.model.EntityFingerprintEntity;
import com.purchasingpower.codelod.repository.DescriptionRecordRepository;
import com.purchasingpower.codelod.repository.EntityFingerprintRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Hash index on top of Spring Data JPA.
 *
 * <p>Writes are serialized by one process-wide lock and each runs in its own
 * transaction, which commits before the lock is released. Reads take no lock;
 * they only ever see committed rows.
 */
@Slf4j
@Service
public class JpaHashIndex implements HashIndex {

    private static final TypeReference<List<String>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final DescriptionRecordRepository records;
    private final EntityFingerprintRepository pointers;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JpaHashIndex(DescriptionRecordRepository records,
                        EntityFingerprintRepository pointers,
                        ObjectMapper objectMapper,
                        PlatformTransactionManager transactionManager) {
        this.records = records;
        this.pointers = pointers;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<DescriptionRecord> get(String fingerprint) {
        if (fingerprint == null) {
            return Optional.empty();
        }
        return read("get " + Fingerprints.abbreviate(fingerprint),
            () -> records.findById(fingerprint).flatMap(this::toRecord));
    }

    @Override
    public void set(String fingerprint, String description, boolean stale, List<String> history) {
        validate(fingerprint, description);
        write("set " + Fingerprints.abbreviate(fingerprint), () -> {
            upsertRecord(fingerprint, description, stale, history);
            return null;
        });
    }

    @Override
    public void record(EntityIdentity identity, String fingerprint, String description, boolean stale,
                       List<String> history) {
        Preconditions.checkNotNull(identity, "identity is required");
        validate(fingerprint, description);
        write("record " + identity, () -> {
            upsertRecord(fingerprint, description, stale, history);
            upsertPointer(identity, fingerprint);
            return null;
        });
        log.debug("Recorded {} -> {}", identity, Fingerprints.abbreviate(fingerprint));
    }

    @Override
    public boolean markStale(String fingerprint) {
        return updateStale(fingerprint, true);
    }

    @Override
    public boolean markFresh(String fingerprint) {
        return updateStale(fingerprint, false);
    }

    @Override
    public List<DescriptionRecord> listStale() {
        return read("listStale", () -> records.findByStaleTrueOrderByFingerprintAsc().stream()
            .map(this::toRecord)
            .flatMap(Optional::stream)
            .toList());
    }

    @Override
    public List<DescriptionRecord> listAll() {
        return read("listAll", () -> records.findAllByOrderByFingerprintAsc().stream()
            .map(this::toRecord)
            .flatMap(Optional::stream)
            .toList());
    }

    @Override
    public long count() {
        return read("count", records::count);
    }

    @Override
    public void delete(String fingerprint) {
        Preconditions.checkNotNull(fingerprint, "fingerprint is required");
        write("delete " + Fingerprints.abbreviate(fingerprint), () -> {
            if (records.existsById(fingerprint)) {
                records.deleteById(fingerprint);
            }
            return null;
        });
    }

    @Override
    public void clear() {
        write("clear", () -> {
            pointers.deleteAllInBatch();
            records.deleteAllInBatch();
            return null;
        });
        log.info("🗑️ Hash index cleared");
    }

    @Override
    public Optional<String> currentFingerprint(EntityIdentity identity) {
        Preconditions.checkNotNull(identity, "identity is required");
        return read("currentFingerprint " + identity,
            () -> pointers.findById(identity.key()).map(EntityFingerprintEntity::getFingerprint));
    }

    @Override
    public void point(EntityIdentity identity, String fingerprint) {
        Preconditions.checkNotNull(identity, "identity is required");
        Preconditions.checkArgument(Fingerprints.isValid(fingerprint), "Invalid fingerprint: %s", fingerprint);
        write("point " + identity, () -> {
            upsertPointer(identity, fingerprint);
            return null;
        });
    }

    private boolean updateStale(String fingerprint, boolean stale) {
        Preconditions.checkNotNull(fingerprint, "fingerprint is required");
        int updated = write("mark " + (stale ? "stale " : "fresh ") + Fingerprints.abbreviate(fingerprint),
            () -> records.updateStale(fingerprint, stale, Instant.now()));
        return updated > 0;
    }

    private void upsertRecord(String fingerprint, String description, boolean stale, List<String> history) {
        Instant now = Instant.now();
        DescriptionRecordEntity entity = records.findById(fingerprint).orElseGet(() -> {
            DescriptionRecordEntity created = new DescriptionRecordEntity();
            created.setFingerprint(fingerprint);
            created.setCreatedAt(now);
            return created;
        });
        entity.setDescription(description);
        entity.setStale(stale);
        entity.setUpdatedAt(now);
        entity.setFingerprintHistory(writeHistory(history == null ? List.of() : history));
        records.save(entity);
    }

    private void upsertPointer(EntityIdentity identity, String fingerprint) {
        EntityFingerprintEntity pointer = pointers.findById(identity.key())
            .orElseGet(EntityFingerprintEntity::new);
        pointer.setIdentityKey(identity.key());
        pointer.setScope(identity.scope().value());
        pointer.setQualifiedName(identity.qualifiedName());
        pointer.setFilePath(identity.filePath());
        pointer.setFingerprint(fingerprint);
        pointer.setUpdatedAt(Instant.now());
        pointers.save(pointer);
    }

    private Optional<DescriptionRecord> toRecord(DescriptionRecordEntity entity) {
        List<String> history;
        try {
            String json = entity.getFingerprintHistory();
            history = json == null || json.isBlank() ? List.of() : objectMapper.readValue(json, HISTORY_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unreadable fingerprint history for {}, treating record as absent: {}",
                Fingerprints.abbreviate(entity.getFingerprint()), e.getOriginalMessage());
            return Optional.empty();
        }
        return Optional.of(DescriptionRecord.builder()
            .fingerprint(entity.getFingerprint())
            .description(entity.getDescription())
            .stale(entity.isStale())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .fingerprintHistory(history == null ? List.of() : List.copyOf(history))
            .build());
    }

    private String writeHistory(List<String> history) {
        try {
            return objectMapper.writeValueAsString(history);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize fingerprint history", e);
        }
    }

    private void validate(String fingerprint, String description) {
        Preconditions.checkArgument(Fingerprints.isValid(fingerprint), "Invalid fingerprint: %s", fingerprint);
        Preconditions.checkNotNull(description, "description is required");
    }

    private <T> T read(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new HashIndexException("Hash index read failed (" + operation + ")", e, isRetryable(e));
        }
    }

    private <T> T write(String operation, Supplier<T> action) {
        writeLock.lock();
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("❌ Hash index write failed ({}): {}", operation, e.getMessage());
            throw new HashIndexException("Hash index write failed (" + operation + ")", e, isRetryable(e));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Locking, connection and disk failures may clear up; integrity and usage errors will not.
     */
    static boolean isRetryable(Exception e) {
        return e instanceof TransientDataAccessException
            || e instanceof RecoverableDataAccessException
            || e instanceof DataAccessResourceFailureException
            || e instanceof TransactionTimedOutException
            || e instanceof CannotCreateTransactionException;
    }
}
