package com.purchasingpower.codelod.sidecar;

import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.index.DescriptionRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Keeps the per-file sidecar records in line with the hash index.
 *
 * <p>The index is the source of truth and sidecars are a regenerable projection. The
 * only way sidecar content reaches the index is {@link #seedIndex()}.
 *
 * @since 0.1.0
 */
public interface SidecarSynchronizer {

    /**
     * Renders the fragment for one entity.
     */
    String project(DescriptionRecord record, ParsedEntity entity);

    /**
     * All well-formed fragments in a sidecar text. Corrupt fragments are skipped.
     */
    List<SidecarFragment> parse(String sidecarText);

    /**
     * Rewrites the sidecar of {@code sourceFile} so it holds exactly one fragment per
     * described entity, in source order. Free text is preserved. The file is only
     * written when its content changes.
     *
     * @return true if the sidecar was written or deleted
     */
    boolean reconcile(Path sourceFile);

    /**
     * Reconciles each file in turn. Stops between files when the thread is interrupted;
     * sidecars already written stay written.
     *
     * @return number of sidecars written or deleted
     */
    int reconcileAll(List<Path> sourceFiles);

    /**
     * Every sidecar under the sidecar root, keyed by its source file, sorted by path.
     */
    Map<Path, List<SidecarFragment>> readAll();

    /**
     * Recovery: inserts index records for sidecar fragments the index does not know,
     * with empty history, and points identities whose entity still matches a fragment
     * at that fragment's fingerprint. Existing records are never overwritten.
     */
    RecoveryReport seedIndex();
}
