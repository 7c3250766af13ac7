package com.purchasingpower.codelod.core;

/**
 * Location of a code entity in its source file. Lines are 1-based and inclusive.
 *
 * @since 0.1.0
 */
public record CodeLocation(String path, int startLine, int endLine) {
}
