package com.purchasingpower.codelod.fingerprint.impl;

import com.google.common.hash.Hashing;
import com.purchasingpower.codelod.core.Languages;
import com.purchasingpower.codelod.fingerprint.FingerprintService;
import com.purchasingpower.codelod.fingerprint.Fingerprints;
import com.purchasingpower.codelod.fingerprint.SourceDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SHA-256 over the normalized UTF-8 form of the source.
 *
 * @since 0.1.0
 */
@Slf4j
@Service
public class SourceNormalizingFingerprintService implements FingerprintService {

    @Override
    public String fingerprint(String rawSource) {
        return fingerprint(rawSource, null);
    }

    @Override
    public String fingerprint(String rawSource, String language) {
        String normalized = normalize(rawSource, language);
        return Fingerprints.ALGORITHM_PREFIX
            + Hashing.sha256().hashString(normalized, StandardCharsets.UTF_8);
    }

    @Override
    public String normalize(String rawSource, String language) {
        return SourceNormalizer.normalize(rawSource, SourceDialect.forLanguage(language));
    }

    @Override
    public String fileFingerprint(Path file) {
        try {
            // Malformed byte sequences are replaced, never rejected
            String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return fingerprint(source, Languages.detect(file).orElse(null));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
