package com.purchasingpower.codelod.pipeline.impl;

import com.purchasingpower.codelod.core.EntityIdentity;
import com.purchasingpower.codelod.core.Freshness;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.fingerprint.Fingerprints;
import com.purchasingpower.codelod.generator.DescriptionGenerator;
import com.purchasingpower.codelod.generator.DescriptionGeneratorFactory;
import com.purchasingpower.codelod.parser.ParserRegistry;
import com.purchasingpower.codelod.pipeline.DescriptionPipeline;
import com.purchasingpower.codelod.pipeline.GenerationReport;
import com.purchasingpower.codelod.sidecar.SidecarSynchronizer;
import com.purchasingpower.codelod.staleness.StalenessTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
public class DescriptionPipelineImpl implements DescriptionPipeline {

    private final ParserRegistry parsers;
    private final StalenessTracker tracker;
    private final SidecarSynchronizer sidecars;
    private final DescriptionGeneratorFactory generatorFactory;
    private final ThreadPoolTaskExecutor executor;

    public DescriptionPipelineImpl(ParserRegistry parsers,
                                   StalenessTracker tracker,
                                   SidecarSynchronizer sidecars,
                                   DescriptionGeneratorFactory generatorFactory,
                                   @Qualifier("generationExecutor") ThreadPoolTaskExecutor executor) {
        this.parsers = parsers;
        this.tracker = tracker;
        this.sidecars = sidecars;
        this.generatorFactory = generatorFactory;
        this.executor = executor;
    }

    @Override
    public GenerationReport generate(List<Path> files, boolean force) {
        return generate(files, force, null, generatorFactory.create());
    }

    @Override
    public GenerationReport generate(List<Path> files, boolean force, Scope scope, DescriptionGenerator generator) {
        long startTime = System.currentTimeMillis();
        log.info("🔄 Generating descriptions for {} files (provider: {}, force: {})",
            files.size(), generator.provider().value(), force);

        Run run = new Run(generator);
        List<CompletableFuture<Void>> fileCompletions = new ArrayList<>();

        for (Path file : files) {
            if (Thread.currentThread().isInterrupted()) {
                run.cancelled.set(true);
                break;
            }
            List<ParsedEntity> entities = parsers.parse(file).stream()
                .filter(e -> scope == null || e.getScope() == scope)
                .toList();
            run.filesScanned.incrementAndGet();
            run.entitiesDiscovered.addAndGet(entities.size());

            List<CompletableFuture<Void>> pending = new ArrayList<>();
            for (ParsedEntity entity : entities) {
                if (Thread.currentThread().isInterrupted()) {
                    run.cancelled.set(true);
                    break;
                }
                if (settleWithoutGeneration(entity, force, run)) {
                    continue;
                }
                pending.add(CompletableFuture.runAsync(() -> generateOne(entity, run), executor));
            }

            fileCompletions.add(CompletableFuture
                .allOf(pending.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> {
                    reconcileSidecar(file, run);
                    return null;
                }));
        }

        try {
            CompletableFuture.allOf(fileCompletions.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancelled.set(true);
            log.warn("⚠️ Generation interrupted; results committed so far are kept");
        } catch (ExecutionException e) {
            run.errors.add("Unexpected pipeline failure: " + e.getCause().getMessage());
            log.error("❌ Unexpected pipeline failure", e.getCause());
        }

        List<String> errors;
        synchronized (run.errors) {
            errors = new ArrayList<>(run.errors);
        }
        GenerationReport report = GenerationReport.builder()
            .filesScanned(run.filesScanned.get())
            .entitiesDiscovered(run.entitiesDiscovered.get())
            .alreadyFresh(run.alreadyFresh.get())
            .reused(run.reused.get())
            .generated(run.generated.get())
            .failed(run.failed.get())
            .sidecarsWritten(run.sidecarsWritten.get())
            .interrupted(run.cancelled.get())
            .durationMs(System.currentTimeMillis() - startTime)
            .errors(errors)
            .build();

        log.info("✅ Generation finished in {}ms: {} generated, {} reused, {} fresh, {} failed, {} sidecars written",
            report.getDurationMs(), report.getGenerated(), report.getReused(), report.getAlreadyFresh(),
            report.getFailed(), report.getSidecarsWritten());
        return report;
    }

    /**
     * Handles everything that needs no generator call.
     *
     * @return true when the entity is settled
     */
    private boolean settleWithoutGeneration(ParsedEntity entity, boolean force, Run run) {
        EntityIdentity identity = entity.identity();
        String fingerprint = entity.getFingerprint();

        if (force && tracker.description(fingerprint).isPresent()) {
            tracker.invalidate(fingerprint);
        }

        Freshness freshness = tracker.check(identity, fingerprint);
        if (freshness != Freshness.FRESH) {
            return false;
        }
        boolean direct = tracker.description(fingerprint).isPresent();
        tracker.adopt(identity, fingerprint);
        if (direct) {
            run.alreadyFresh.incrementAndGet();
        } else {
            run.reused.incrementAndGet();
        }
        return true;
    }

    private void generateOne(ParsedEntity entity, Run run) {
        if (run.cancelled.get()) {
            return;
        }
        EntityIdentity identity = entity.identity();
        try {
            String description = run.generator.generate(entity, null);

            // Another worker may have described the same content meanwhile
            if (tracker.check(identity, entity.getFingerprint()) == Freshness.FRESH) {
                tracker.adopt(identity, entity.getFingerprint());
                run.reused.incrementAndGet();
                return;
            }
            tracker.recordGenerated(identity, entity.getFingerprint(), description);
            run.generated.incrementAndGet();
        } catch (RuntimeException e) {
            run.failed.incrementAndGet();
            run.errors.add(identity + ": " + e.getMessage());
            log.error("❌ Failed to describe {} ({}): {}",
                identity, Fingerprints.abbreviate(entity.getFingerprint()), e.getMessage());
        }
    }

    private void reconcileSidecar(Path file, Run run) {
        try {
            if (sidecars.reconcile(file)) {
                run.sidecarsWritten.incrementAndGet();
            }
        } catch (RuntimeException e) {
            run.errors.add(file + ": " + e.getMessage());
            log.error("❌ Failed to update sidecar for {}: {}", file, e.getMessage());
        }
    }

    private static final class Run {
        private final DescriptionGenerator generator;
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final AtomicInteger filesScanned = new AtomicInteger();
        private final AtomicInteger entitiesDiscovered = new AtomicInteger();
        private final AtomicInteger alreadyFresh = new AtomicInteger();
        private final AtomicInteger reused = new AtomicInteger();
        private final AtomicInteger generated = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger sidecarsWritten = new AtomicInteger();
        private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

        Run(DescriptionGenerator generator) {
            this.generator = generator;
        }
    }
}
