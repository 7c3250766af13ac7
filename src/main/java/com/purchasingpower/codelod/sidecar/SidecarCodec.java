package com.purchasingpower.codelod.sidecar;

import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.fingerprint.Fingerprints;
import com.purchasingpower.codelod.fingerprint.SourceDialect;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the sidecar fragment grammar:
 *
 * <pre>
 * // &#64;lod hash:sha256:&lt;64 hex&gt; stale:false
 * // &#64;lod description:Validates the token and returns the user.
 * public User authenticate(String token) {
 * </pre>
 *
 * <p>The comment prefix follows the source language ({@code #} or {@code //}); both are
 * accepted on read. Fragments are separated by a blank line. Free text after a
 * fragment is kept, separated from it by a blank line. Rendering a parsed document
 * gives back the same text, so rewriting is stable.
 */
@Slf4j
public final class SidecarCodec {

    private static final Pattern LOD_LINE = Pattern.compile("^\\s*(?:#|//)\\s*@lod\\s+(\\w+):\\s*(.*)$");
    private static final Pattern COMMENT_LINE = Pattern.compile("^\\s*(?:#|//)\\s?(.*)$");
    private static final Pattern HASH_VALUE = Pattern.compile("^(sha256:[0-9a-f]{64})\\b(.*)$");
    private static final Pattern STALE_TOKEN = Pattern.compile("\\bstale:(\\S+)");

    private SidecarCodec() {
    }

    /**
     * Comment prefix for a sidecar mirroring a file in {@code language}.
     */
    public static String commentPrefix(String language) {
        return SourceDialect.forLanguage(language).lineComment();
    }

    /**
     * Declaration line used as the fragment's signature: the first line that is not blank,
     * an annotation or a decorator. Modules use a synthetic {@code module <path>} line.
     */
    public static String signatureOf(ParsedEntity entity) {
        if (entity.getScope() == Scope.MODULE || entity.getScope() == Scope.PACKAGE
            || entity.getScope() == Scope.PROJECT) {
            return entity.getScope().value() + " " + entity.getName();
        }
        String fallback = null;
        for (String line : entity.getSource().split("\n")) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            if (fallback == null) {
                fallback = stripped;
            }
            boolean annotation = stripped.startsWith("@") && !stripped.startsWith("@interface");
            if (!annotation && !COMMENT_LINE.matcher(stripped).matches()) {
                return stripped;
            }
        }
        return fallback != null && !COMMENT_LINE.matcher(fallback).matches()
            ? fallback
            : entity.getScope().value() + " " + entity.getName();
    }

    /**
     * Descriptions are stored on one line in the sidecar.
     */
    public static String foldDescription(String description) {
        String folded = description == null ? "" : description.strip().replaceAll("\\s+", " ");
        return folded.isEmpty() ? "(no description)" : folded;
    }

    public static String renderFragment(SidecarFragment fragment, String prefix) {
        StringBuilder out = new StringBuilder();
        out.append(prefix).append(" @lod hash:").append(fragment.getFingerprint())
            .append(" stale:").append(fragment.isStale()).append('\n');
        out.append(prefix).append(" @lod description:").append(foldDescription(fragment.getDescription()));
        if (fragment.getSignature() != null && !fragment.getSignature().isBlank()) {
            out.append('\n').append(fragment.getSignature());
        }
        if (!fragment.getTrailingLines().isEmpty()) {
            out.append("\n\n").append(String.join("\n", fragment.getTrailingLines()));
        }
        return out.toString();
    }

    public static String render(SidecarDocument document, String prefix) {
        List<String> blocks = new ArrayList<>();
        if (!document.getPreamble().isEmpty()) {
            blocks.add(String.join("\n", document.getPreamble()));
        }
        for (SidecarFragment fragment : document.getFragments()) {
            blocks.add(renderFragment(fragment, prefix));
        }
        return blocks.isEmpty() ? "" : String.join("\n\n", blocks) + "\n";
    }

    /**
     * Parses a sidecar file. Fragments without a valid fingerprint or description are
     * skipped up to the next blank line and logged; everything else is still returned.
     */
    public static SidecarDocument parse(String text, String sourceName) {
        if (text == null || text.isEmpty()) {
            return SidecarDocument.empty();
        }
        String[] lines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);

        List<String> preamble = new ArrayList<>();
        List<SidecarFragment> fragments = new ArrayList<>();
        FragmentBuilder current = null;
        boolean skipping = false;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNo = i + 1;

            if (line.isBlank()) {
                skipping = false;
                if (current == null && fragments.isEmpty()) {
                    preamble.add(line);
                } else if (current != null) {
                    current.sawBlank = true;
                }
                continue;
            }
            if (skipping) {
                continue;
            }

            Matcher lod = LOD_LINE.matcher(line);
            if (lod.matches()) {
                String key = lod.group(1).toLowerCase(Locale.ROOT);
                String value = lod.group(2).strip();
                if ("hash".equals(key)) {
                    close(current, fragments, sourceName);
                    current = null;
                    Matcher hash = HASH_VALUE.matcher(value);
                    if (!hash.matches() || !Fingerprints.isValid(hash.group(1))) {
                        log.warn("⚠️ Skipping malformed @lod fragment at {}:{}: bad hash '{}'", sourceName, lineNo, value);
                        skipping = true;
                        continue;
                    }
                    current = new FragmentBuilder(hash.group(1), lineNo);
                    Matcher stale = STALE_TOKEN.matcher(hash.group(2));
                    if (stale.find()) {
                        current.stale = parseBoolean(stale.group(1));
                    }
                } else if (current == null || current.signature != null) {
                    close(current, fragments, sourceName);
                    current = null;
                    log.warn("⚠️ Skipping @lod {} line without a hash at {}:{}", key, sourceName, lineNo);
                    skipping = true;
                } else if ("stale".equals(key)) {
                    current.stale = parseBoolean(value);
                    current.endLine = lineNo;
                } else if ("description".equals(key)) {
                    current.appendDescription(value);
                    current.endLine = lineNo;
                } else {
                    log.debug("Ignoring unknown @lod key '{}' at {}:{}", key, sourceName, lineNo);
                    current.endLine = lineNo;
                }
                continue;
            }

            if (current == null) {
                if (fragments.isEmpty()) {
                    preamble.add(line);
                } else {
                    // Free text after a skipped fragment: keep it with the last good one
                    SidecarFragment last = fragments.remove(fragments.size() - 1);
                    List<String> trailing = new ArrayList<>(last.getTrailingLines());
                    trailing.add(line);
                    fragments.add(last.toBuilder().trailingLines(List.copyOf(trailing)).build());
                }
                continue;
            }

            if (current.signature == null && !current.sawBlank) {
                Matcher comment = COMMENT_LINE.matcher(line);
                if (comment.matches() && current.description.length() > 0) {
                    current.appendDescription(comment.group(1).strip());
                    current.endLine = lineNo;
                } else {
                    current.signature = line;
                    current.endLine = lineNo;
                }
            } else {
                current.trailing.add(line);
            }
        }
        close(current, fragments, sourceName);

        while (!preamble.isEmpty() && preamble.get(preamble.size() - 1).isBlank()) {
            preamble.remove(preamble.size() - 1);
        }
        return SidecarDocument.builder()
            .preamble(List.copyOf(preamble))
            .fragments(List.copyOf(fragments))
            .build();
    }

    private static void close(FragmentBuilder builder, List<SidecarFragment> fragments, String sourceName) {
        if (builder == null) {
            return;
        }
        if (builder.description.length() == 0) {
            log.warn("⚠️ Skipping @lod fragment without description at {}:{}", sourceName, builder.startLine);
            return;
        }
        fragments.add(SidecarFragment.builder()
            .fingerprint(builder.fingerprint)
            .stale(builder.stale)
            .description(builder.description.toString())
            .signature(builder.signature)
            .startLine(builder.startLine)
            .endLine(builder.endLine)
            .trailingLines(List.copyOf(builder.trailing))
            .build());
    }

    private static boolean parseBoolean(String value) {
        String v = value.strip().toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("yes");
    }

    private static final class FragmentBuilder {
        private final String fingerprint;
        private final int startLine;
        private final StringBuilder description = new StringBuilder();
        private final List<String> trailing = new ArrayList<>();
        private boolean stale;
        private String signature;
        private int endLine;
        private boolean sawBlank;

        FragmentBuilder(String fingerprint, int startLine) {
            this.fingerprint = fingerprint;
            this.startLine = startLine;
            this.endLine = startLine;
        }

        void appendDescription(String text) {
            if (text.isEmpty()) {
                return;
            }
            if (description.length() > 0) {
                description.append(' ');
            }
            description.append(text);
        }
    }
}
