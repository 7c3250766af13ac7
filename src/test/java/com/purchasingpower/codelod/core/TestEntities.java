package com.purchasingpower.codelod.core;

import com.purchasingpower.codelod.fingerprint.FingerprintService;
import com.purchasingpower.codelod.fingerprint.impl.SourceNormalizingFingerprintService;

/**
 * Builds parsed entities for tests without going through a parser.
 */
public final class TestEntities {

    private static final FingerprintService FINGERPRINTS = new SourceNormalizingFingerprintService();

    private TestEntities() {
    }

    public static String fingerprint(String source) {
        return FINGERPRINTS.fingerprint(source, "python");
    }

    public static ParsedEntity function(String name, String path, String source) {
        return ParsedEntity.builder()
            .scope(Scope.FUNCTION)
            .name(name)
            .location(new CodeLocation(path, 1, source.split("\n").length))
            .source(source)
            .fingerprint(fingerprint(source))
            .language("python")
            .build();
    }

    public static EntityIdentity functionIdentity(String name, String path) {
        return new EntityIdentity(Scope.FUNCTION, name, path);
    }
}
