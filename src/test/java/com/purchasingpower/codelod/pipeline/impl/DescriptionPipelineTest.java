package com.purchasingpower.codelod.pipeline.impl;

import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.core.Freshness;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.exception.DescriptionGenerationException;
import com.purchasingpower.codelod.fingerprint.impl.SourceNormalizingFingerprintService;
import com.purchasingpower.codelod.generator.DescriptionGenerator;
import com.purchasingpower.codelod.generator.DescriptionGeneratorFactory;
import com.purchasingpower.codelod.generator.Provider;
import com.purchasingpower.codelod.index.HashIndex;
import com.purchasingpower.codelod.parser.ParserRegistry;
import com.purchasingpower.codelod.parser.impl.JavaSourceParser;
import com.purchasingpower.codelod.pipeline.GenerationReport;
import com.purchasingpower.codelod.sidecar.SidecarFragment;
import com.purchasingpower.codelod.sidecar.impl.SidecarSynchronizerImpl;
import com.purchasingpower.codelod.staleness.StalenessTracker;
import com.purchasingpower.codelod.staleness.impl.StalenessTrackerImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Description Pipeline Tests")
class DescriptionPipelineTest {

    private static final String CALCULATOR = """
        package demo;

        public class Calculator {

            public int add(int a, int b) {
                return a + b;
            }

            public int negate(int a) {
                return -a;
            }
        }
        """;

    @Autowired
    private HashIndex index;

    @Autowired
    @Qualifier("generationExecutor")
    private ThreadPoolTaskExecutor executor;

    @TempDir
    Path projectDir;

    private StalenessTracker tracker;
    private ParserRegistry parsers;
    private SidecarSynchronizerImpl sidecars;
    private DescriptionPipelineImpl pipeline;
    private CountingGenerator generator;
    private CodeLodPaths paths;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        index.clear();
        paths = CodeLodPaths.of(projectDir);
        CodeLodProperties properties = new CodeLodProperties();
        parsers = new ParserRegistry(
            List.of(new JavaSourceParser(new SourceNormalizingFingerprintService(), paths)), properties);
        tracker = new StalenessTrackerImpl(index, properties);
        sidecars = new SidecarSynchronizerImpl(index, parsers, paths);
        pipeline = new DescriptionPipelineImpl(parsers, tracker, sidecars,
            new DescriptionGeneratorFactory(properties), executor);
        generator = new CountingGenerator();

        source = projectDir.resolve("src/demo/Calculator.java");
        Files.createDirectories(source.getParent());
        write(CALCULATOR);
    }

    @Test
    @DisplayName("Fresh entities are never sent to the generator again")
    void secondRunGeneratesNothing() {
        // When
        GenerationReport first = pipeline.generate(List.of(source), false, null, generator);
        GenerationReport second = pipeline.generate(List.of(source), false, null, generator);

        // Then
        assertThat(first.getEntitiesDiscovered()).isEqualTo(4);
        assertThat(first.getGenerated()).isEqualTo(4);
        assertThat(first.getSidecarsWritten()).isEqualTo(1);
        assertThat(first.isSuccess()).isTrue();

        assertThat(second.getAlreadyFresh()).isEqualTo(4);
        assertThat(second.getGenerated()).isZero();
        assertThat(second.getSidecarsWritten()).isZero();
        assertThat(generator.calls.get()).isEqualTo(4);
        assertThat(Files.exists(paths.sidecarFor(source))).isTrue();
    }

    @Test
    @DisplayName("An edit regenerates only what changed and reverting it generates nothing")
    void editThenRevert() throws IOException {
        pipeline.generate(List.of(source), false, null, generator);

        // When: the body of add changes, which also changes the class and the module
        write(CALCULATOR.replace("return a + b;", "return Math.addExact(a, b);"));
        GenerationReport edited = pipeline.generate(List.of(source), false, null, generator);

        // Then
        assertThat(edited.getGenerated()).isEqualTo(3);
        assertThat(edited.getAlreadyFresh()).isEqualTo(1);
        assertThat(generator.names).contains("Calculator.add");

        // When: the edit is reverted
        int callsBefore = generator.calls.get();
        write(CALCULATOR);
        GenerationReport reverted = pipeline.generate(List.of(source), false, null, generator);

        // Then
        assertThat(reverted.getGenerated()).isZero();
        assertThat(reverted.getAlreadyFresh() + reverted.getReused()).isEqualTo(4);
        assertThat(generator.calls.get()).isEqualTo(callsBefore);
        for (ParsedEntity entity : parsers.parse(source)) {
            assertThat(index.currentFingerprint(entity.identity())).contains(entity.getFingerprint());
            assertThat(tracker.resolveDescription(entity.identity(), entity.getFingerprint()))
                .contains("About " + entity.getName());
        }
    }

    @Test
    @DisplayName("One failing entity does not stop the others from being recorded")
    void failureIsIsolated() throws IOException {
        generator.failFor.add("Calculator.add");

        GenerationReport report = pipeline.generate(List.of(source), false, null, generator);

        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getGenerated()).isEqualTo(3);
        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getErrors()).singleElement().asString().contains("Calculator.add");

        ParsedEntity add = parsers.parse(source).stream()
            .filter(e -> e.getName().equals("Calculator.add"))
            .findFirst().orElseThrow();
        assertThat(tracker.check(add.identity(), add.getFingerprint())).isEqualTo(Freshness.UNKNOWN);

        List<SidecarFragment> fragments = sidecars.parse(Files.readString(paths.sidecarFor(source)));
        assertThat(fragments).hasSize(3);
    }

    @Test
    @DisplayName("Forcing regenerates descriptions that are still fresh")
    void forceRegenerates() {
        pipeline.generate(List.of(source), false, null, generator);

        GenerationReport forced = pipeline.generate(List.of(source), true, null, generator);

        assertThat(forced.getGenerated()).isEqualTo(4);
        assertThat(forced.getAlreadyFresh()).isZero();
        assertThat(generator.calls.get()).isEqualTo(8);
        assertThat(tracker.listStale()).isEmpty();
    }

    @Test
    @DisplayName("A scope filter limits which entities are generated")
    void scopeFilter() {
        GenerationReport report = pipeline.generate(List.of(source), false, Scope.FUNCTION, generator);

        assertThat(report.getEntitiesDiscovered()).isEqualTo(2);
        assertThat(report.getGenerated()).isEqualTo(2);
        assertThat(generator.names).containsExactlyInAnyOrder("Calculator.add", "Calculator.negate");
    }

    @Test
    @DisplayName("Interrupting a run stops it between entities and keeps what was already recorded")
    void interruptionKeepsCommittedResults() {
        // Given: a single worker, and a generator that interrupts the caller on its first call
        ThreadPoolTaskExecutor singleWorker = new ThreadPoolTaskExecutor();
        singleWorker.setCorePoolSize(1);
        singleWorker.setMaxPoolSize(1);
        singleWorker.setWaitForTasksToCompleteOnShutdown(true);
        singleWorker.setAwaitTerminationSeconds(10);
        singleWorker.initialize();
        DescriptionPipelineImpl interruptible = new DescriptionPipelineImpl(parsers, tracker, sidecars,
            new DescriptionGeneratorFactory(new CodeLodProperties()), singleWorker);
        InterruptingGenerator interrupting = new InterruptingGenerator(Thread.currentThread());

        // When
        GenerationReport report;
        try {
            report = interruptible.generate(List.of(source), false, null, interrupting);
        } finally {
            Thread.interrupted();
            interrupting.release.countDown();
            singleWorker.shutdown();
        }

        // Then: only the entity in flight was described and committed
        assertThat(report.isInterrupted()).isTrue();
        assertThat(interrupting.calls.get()).isEqualTo(1);
        assertThat(index.count()).isEqualTo(1);
        assertThat(index.listStale()).isEmpty();

        // When: the run is repeated without interruption
        GenerationReport resumed = pipeline.generate(List.of(source), false, null, generator);

        // Then
        assertThat(resumed.getAlreadyFresh()).isEqualTo(1);
        assertThat(resumed.getGenerated()).isEqualTo(3);
    }

    private void write(String content) throws IOException {
        Files.writeString(source, content, StandardCharsets.UTF_8);
    }

    private static final class InterruptingGenerator implements DescriptionGenerator {

        private final Thread caller;
        private final AtomicInteger calls = new AtomicInteger();
        private final CountDownLatch release = new CountDownLatch(1);

        InterruptingGenerator(Thread caller) {
            this.caller = caller;
        }

        @Override
        public Provider provider() {
            return Provider.MOCK;
        }

        @Override
        public String generate(ParsedEntity entity, String context) {
            if (calls.incrementAndGet() == 1) {
                caller.interrupt();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return "About " + entity.getName();
        }
    }

    private static final class CountingGenerator implements DescriptionGenerator {

        private final AtomicInteger calls = new AtomicInteger();
        private final Set<String> names = ConcurrentHashMap.newKeySet();
        private final Set<String> failFor = ConcurrentHashMap.newKeySet();

        @Override
        public Provider provider() {
            return Provider.MOCK;
        }

        @Override
        public String generate(ParsedEntity entity, String context) {
            calls.incrementAndGet();
            names.add(entity.getName());
            if (failFor.contains(entity.getName())) {
                throw new DescriptionGenerationException(entity.getName(), "model unavailable", null);
            }
            return "About " + entity.getName();
        }
    }
}
