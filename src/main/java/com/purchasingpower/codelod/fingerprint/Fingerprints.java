package com.purchasingpower.codelod.fingerprint;

import java.util.regex.Pattern;

/**
 * Format of fingerprint values: {@code sha256:} followed by 64 lower-case hex digits.
 * The algorithm tag keeps entries distinguishable if the algorithm ever changes.
 */
public final class Fingerprints {

    public static final String ALGORITHM_PREFIX = "sha256:";
    public static final Pattern PATTERN = Pattern.compile("sha256:[0-9a-f]{64}");

    private Fingerprints() {
    }

    public static boolean isValid(String fingerprint) {
        return fingerprint != null && PATTERN.matcher(fingerprint).matches();
    }

    /**
     * Short form for log lines and console output.
     */
    public static String abbreviate(String fingerprint) {
        if (fingerprint == null) {
            return "none";
        }
        int end = Math.min(fingerprint.length(), ALGORITHM_PREFIX.length() + 12);
        return fingerprint.substring(0, end);
    }
}
