package com.purchasingpower.codelod.sidecar.impl;

import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.exception.SidecarException;
import com.purchasingpower.codelod.index.DescriptionRecord;
import com.purchasingpower.codelod.index.HashIndex;
import com.purchasingpower.codelod.parser.ParserRegistry;
import com.purchasingpower.codelod.sidecar.RecoveryReport;
import com.purchasingpower.codelod.sidecar.SidecarCodec;
import com.purchasingpower.codelod.sidecar.SidecarDocument;
import com.purchasingpower.codelod.sidecar.SidecarFragment;
import com.purchasingpower.codelod.sidecar.SidecarSynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class SidecarSynchronizerImpl implements SidecarSynchronizer {

    private final HashIndex index;
    private final ParserRegistry parsers;
    private final CodeLodPaths paths;

    @Override
    public String project(DescriptionRecord record, ParsedEntity entity) {
        SidecarFragment fragment = SidecarFragment.builder()
            .fingerprint(record.getFingerprint())
            .stale(record.isStale())
            .description(record.getDescription())
            .signature(SidecarCodec.signatureOf(entity))
            .build();
        return SidecarCodec.renderFragment(fragment, SidecarCodec.commentPrefix(entity.getLanguage()));
    }

    @Override
    public List<SidecarFragment> parse(String sidecarText) {
        return SidecarCodec.parse(sidecarText, "<sidecar>").getFragments();
    }

    @Override
    public boolean reconcile(Path sourceFile) {
        Path source = sourceFile.toAbsolutePath().normalize();
        Path sidecar = paths.sidecarFor(source);
        String sidecarName = paths.relativize(sidecar);

        SidecarDocument existing = read(sidecar, sidecarName);

        if (!Files.exists(source)) {
            return deleteSidecar(sidecar);
        }

        List<ParsedEntity> entities = parsers.parse(source);
        if (entities.isEmpty()) {
            // Unsupported or currently unparsable: keep what is there
            log.debug("No entities in {}, sidecar left untouched", paths.relativize(source));
            return false;
        }
        String language = entities.get(0).getLanguage();

        Map<String, SidecarFragment> byFingerprint = new HashMap<>();
        Map<String, SidecarFragment> bySignature = new HashMap<>();
        for (SidecarFragment fragment : existing.getFragments()) {
            byFingerprint.putIfAbsent(fragment.getFingerprint(), fragment);
            if (fragment.getSignature() != null) {
                bySignature.putIfAbsent(fragment.getSignature().strip(), fragment);
            }
        }

        List<SidecarFragment> fragments = new ArrayList<>();
        Set<SidecarFragment> claimed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ParsedEntity entity : entities) {
            Optional<SidecarFragment> projected = projectEntity(entity);
            if (projected.isEmpty()) {
                continue;
            }
            SidecarFragment fragment = projected.get();
            SidecarFragment previous = byFingerprint.get(fragment.getFingerprint());
            if (previous == null || claimed.contains(previous)) {
                previous = bySignature.get(fragment.getSignature().strip());
            }
            if (previous != null && !claimed.contains(previous)) {
                claimed.add(previous);
                fragment = fragment.toBuilder().trailingLines(previous.getTrailingLines()).build();
            }
            fragments.add(fragment);
        }

        List<String> orphaned = new ArrayList<>();
        for (SidecarFragment fragment : existing.getFragments()) {
            if (!claimed.contains(fragment)) {
                orphaned.addAll(fragment.getTrailingLines());
            }
        }

        List<String> preamble = new ArrayList<>(existing.getPreamble());
        if (!orphaned.isEmpty()) {
            if (fragments.isEmpty()) {
                if (!preamble.isEmpty()) {
                    preamble.add("");
                }
                preamble.addAll(orphaned);
            } else {
                SidecarFragment last = fragments.remove(fragments.size() - 1);
                List<String> trailing = new ArrayList<>(last.getTrailingLines());
                trailing.addAll(orphaned);
                fragments.add(last.toBuilder().trailingLines(List.copyOf(trailing)).build());
            }
        }

        SidecarDocument document = SidecarDocument.builder()
            .preamble(List.copyOf(preamble))
            .fragments(List.copyOf(fragments))
            .build();
        String rendered = SidecarCodec.render(document, SidecarCodec.commentPrefix(language));

        if (rendered.isEmpty()) {
            return deleteSidecar(sidecar);
        }
        return write(sidecar, rendered, sidecarName, fragments.size());
    }

    @Override
    public int reconcileAll(List<Path> sourceFiles) {
        int written = 0;
        for (Path file : sourceFiles) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("⚠️ Sidecar reconciliation interrupted after {} of {} files", written, sourceFiles.size());
                break;
            }
            if (reconcile(file)) {
                written++;
            }
        }
        log.info("📝 Reconciled {} files, {} sidecars changed", sourceFiles.size(), written);
        return written;
    }

    @Override
    public Map<Path, List<SidecarFragment>> readAll() {
        Map<Path, List<SidecarFragment>> result = new TreeMap<>();
        for (Path sidecar : listSidecars()) {
            SidecarDocument document = read(sidecar, paths.relativize(sidecar));
            result.put(paths.sourceFor(sidecar), document.getFragments());
        }
        return new LinkedHashMap<>(result);
    }

    @Override
    public RecoveryReport seedIndex() {
        int sidecars = 0;
        int fragmentsRead = 0;
        int seeded = 0;
        int present = 0;
        int pointed = 0;

        for (Map.Entry<Path, List<SidecarFragment>> entry : readAll().entrySet()) {
            sidecars++;
            List<SidecarFragment> fragments = entry.getValue();
            fragmentsRead += fragments.size();

            for (SidecarFragment fragment : fragments) {
                if (index.get(fragment.getFingerprint()).isPresent()) {
                    present++;
                    continue;
                }
                index.set(fragment.getFingerprint(), fragment.getDescription(), fragment.isStale(), List.of());
                seeded++;
            }

            Path source = entry.getKey();
            if (!Files.exists(source)) {
                continue;
            }
            Map<String, SidecarFragment> byFingerprint = new HashMap<>();
            Map<String, SidecarFragment> bySignature = new HashMap<>();
            for (SidecarFragment fragment : fragments) {
                byFingerprint.putIfAbsent(fragment.getFingerprint(), fragment);
                if (fragment.getSignature() != null) {
                    bySignature.putIfAbsent(fragment.getSignature().strip(), fragment);
                }
            }
            for (ParsedEntity entity : parsers.parse(source)) {
                if (index.currentFingerprint(entity.identity()).isPresent()) {
                    continue;
                }
                SidecarFragment match = byFingerprint.get(entity.getFingerprint());
                if (match == null) {
                    match = bySignature.get(SidecarCodec.signatureOf(entity));
                }
                if (match != null) {
                    index.point(entity.identity(), match.getFingerprint());
                    pointed++;
                }
            }
        }

        log.info("♻️ Recovery: {} sidecars, {} fragments, {} records seeded, {} already present, {} identities linked",
            sidecars, fragmentsRead, seeded, present, pointed);
        return RecoveryReport.builder()
            .sidecarsRead(sidecars)
            .fragmentsRead(fragmentsRead)
            .recordsSeeded(seeded)
            .recordsAlreadyPresent(present)
            .identitiesPointed(pointed)
            .build();
    }

    /**
     * The record that describes the entity now, or its last description flagged stale
     * when the code has moved on since.
     */
    private Optional<SidecarFragment> projectEntity(ParsedEntity entity) {
        Optional<DescriptionRecord> current = index.get(entity.getFingerprint());
        boolean outdated = false;
        if (current.isEmpty()) {
            current = index.currentFingerprint(entity.identity()).flatMap(index::get);
            outdated = true;
        }
        if (current.isEmpty()) {
            return Optional.empty();
        }
        DescriptionRecord record = current.get();
        return Optional.of(SidecarFragment.builder()
            .fingerprint(record.getFingerprint())
            .stale(record.isStale() || outdated)
            .description(record.getDescription())
            .signature(SidecarCodec.signatureOf(entity))
            .build());
    }

    private SidecarDocument read(Path sidecar, String sidecarName) {
        if (!Files.isRegularFile(sidecar)) {
            return SidecarDocument.empty();
        }
        try {
            return SidecarCodec.parse(Files.readString(sidecar, StandardCharsets.UTF_8), sidecarName);
        } catch (IOException e) {
            throw new SidecarException(sidecar, "Failed to read sidecar", e);
        }
    }

    private boolean write(Path sidecar, String content, String sidecarName, int fragmentCount) {
        try {
            if (Files.isRegularFile(sidecar)
                && Files.readString(sidecar, StandardCharsets.UTF_8).equals(content)) {
                log.debug("Sidecar {} unchanged", sidecarName);
                return false;
            }
            Files.createDirectories(sidecar.getParent());
            Path temp = Files.createTempFile(sidecar.getParent(), ".lod-", ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, sidecar, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("📝 Wrote sidecar {} ({} fragments)", sidecarName, fragmentCount);
            return true;
        } catch (IOException e) {
            throw new SidecarException(sidecar, "Failed to write sidecar", e);
        }
    }

    private boolean deleteSidecar(Path sidecar) {
        try {
            boolean deleted = Files.deleteIfExists(sidecar);
            if (deleted) {
                log.info("🗑️ Removed sidecar {}", paths.relativize(sidecar));
            }
            return deleted;
        } catch (IOException e) {
            throw new SidecarException(sidecar, "Failed to delete sidecar", e);
        }
    }

    private List<Path> listSidecars() {
        if (!Files.isDirectory(paths.lodDir())) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(paths.lodDir())) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(CodeLodPaths.SIDECAR_SUFFIX))
                .map(p -> p.toAbsolutePath().normalize())
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new SidecarException(paths.lodDir(), "Failed to list sidecars", e);
        }
    }
}
