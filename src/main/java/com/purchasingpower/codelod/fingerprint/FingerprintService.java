package com.purchasingpower.codelod.fingerprint;

import java.nio.file.Path;

/**
 * Turns raw entity source into a formatting-insensitive content fingerprint.
 *
 * Implementations are pure and total: any input, however malformed, is fingerprinted.
 *
 * @since 0.1.0
 */
public interface FingerprintService {

    /**
     * Fingerprint using the default (hash-comment) dialect.
     */
    String fingerprint(String rawSource);

    /**
     * Fingerprint using the comment and quoting rules of the given language tag.
     * Unknown tags fall back to the default dialect.
     */
    String fingerprint(String rawSource, String language);

    /**
     * Canonical text that is hashed. Exposed for diagnostics and tests.
     */
    String normalize(String rawSource, String language);

    /**
     * Fingerprint of a whole file, language taken from the file extension.
     */
    String fileFingerprint(Path file);
}
