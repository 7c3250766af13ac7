package com.purchasingpower.codelod.fingerprint.impl;

import com.purchasingpower.codelod.fingerprint.SourceDialect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Canonicalizes source text so that formatting-only edits produce identical output.
 *
 * <p>Comments outside string literals are removed, whitespace between tokens is dropped
 * unless it separates two word characters or two characters that would fuse into another
 * operator, blank lines disappear, and line endings are unified. For line-structured
 * dialects, leading indentation is replaced by its nesting depth, so the indentation width
 * does not matter while the block structure does. String literal contents are kept
 * verbatim; only the quote style is unified where the dialect treats both styles alike,
 * and text blocks lose their incidental indentation.
 *
 * <p>Never throws on odd input: unterminated literals and comments simply run to the
 * end of the line or of the text.
 */
final class SourceNormalizer {

    private static final int TAB_WIDTH = 4;

    /**
     * Two-character operators and comment openers. A space between their halves keeps
     * {@code - -y} apart from {@code --y}.
     */
    private static final Set<String> FUSING_PAIRS = Set.of(
        "++", "--", "&&", "||", "==", "!=", "<=", ">=", "<<", ">>", "::", "**", "->", "=>", "<-",
        "..", "?.", "??", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "//", "/*", "*/");

    private SourceNormalizer() {
    }

    static String normalize(String source, SourceDialect dialect) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        String text = source.charAt(0) == '\uFEFF' ? source.substring(1) : source;
        text = text.replace("\r\n", "\n").replace('\r', '\n');
        return new Scanner(text, dialect).run();
    }

    private static final class Scanner {

        private final String text;
        private final SourceDialect dialect;
        private final List<String> lines = new ArrayList<>();
        private final Deque<Integer> indentStack = new ArrayDeque<>();
        private final StringBuilder current = new StringBuilder();

        private int pos;
        private int indentWidth;
        private boolean atLineStart = true;
        private boolean pendingSpace;

        Scanner(String text, SourceDialect dialect) {
            this.text = text;
            this.dialect = dialect;
        }

        String run() {
            while (pos < text.length()) {
                char c = text.charAt(pos);

                if (c == '\n') {
                    if (dialect.isLineStructured()) {
                        endLine();
                    } else {
                        pendingSpace = true;
                    }
                    pos++;
                    continue;
                }

                if (atLineStart && dialect.isLineStructured()) {
                    if (c == ' ') {
                        indentWidth++;
                        pos++;
                        continue;
                    }
                    if (c == '\t') {
                        indentWidth += TAB_WIDTH - (indentWidth % TAB_WIDTH);
                        pos++;
                        continue;
                    }
                    atLineStart = false;
                }

                if (text.startsWith(dialect.lineComment(), pos)) {
                    skipLineComment();
                } else if (dialect.blockCommentStart() != null && text.startsWith(dialect.blockCommentStart(), pos)) {
                    skipBlockComment();
                } else if (dialect.isQuote(c)) {
                    readLiteral(c);
                } else if (Character.isWhitespace(c)) {
                    pendingSpace = true;
                    pos++;
                } else {
                    emit(c);
                    pos++;
                }
            }
            endLine();
            return String.join("\n", lines);
        }

        private void skipLineComment() {
            int newline = text.indexOf('\n', pos);
            pos = newline < 0 ? text.length() : newline;
        }

        private void skipBlockComment() {
            int bodyStart = pos + dialect.blockCommentStart().length();
            int end = text.indexOf(dialect.blockCommentEnd(), bodyStart);
            pos = end < 0 ? text.length() : end + dialect.blockCommentEnd().length();
            pendingSpace = true;
        }

        private void readLiteral(char quote) {
            String triple = String.valueOf(quote).repeat(3);
            boolean isTriple = dialect.supportsTripleQuotes(quote) && text.startsWith(triple, pos);
            String delimiter = isTriple ? triple : String.valueOf(quote);

            int i = pos + delimiter.length();
            StringBuilder body = new StringBuilder();
            boolean closed = false;
            while (i < text.length()) {
                char ch = text.charAt(i);
                if (ch == '\\' && i + 1 < text.length()) {
                    body.append(ch).append(text.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (text.startsWith(delimiter, i)) {
                    closed = true;
                    i += delimiter.length();
                    break;
                }
                if (ch == '\n' && !isTriple && quote != '`') {
                    break;
                }
                body.append(ch);
                i++;
            }
            pos = i;

            String content = body.toString();
            if (isTriple && dialect.stripsTextBlockIndent()) {
                content = textBlockValue(content);
            }
            char target = quote;
            if (quote == dialect.quoteToNormalize()) {
                target = '"';
                if (!isTriple) {
                    content = requote(content);
                }
            }
            String outDelimiter = isTriple ? String.valueOf(target).repeat(3) : String.valueOf(target);
            pendingSpace = false;
            current.append(outDelimiter).append(content);
            if (closed) {
                current.append(outDelimiter);
            }
        }

        /**
         * Content of a text block without the opening line break and incidental indentation.
         */
        private static String textBlockValue(String body) {
            int firstBreak = body.indexOf('\n');
            if (firstBreak < 0 || !body.substring(0, firstBreak).isBlank()) {
                return body;
            }
            return body.substring(firstBreak + 1).stripIndent();
        }

        /**
         * Rewrites the body of a single-quoted literal for double quotes.
         */
        private static String requote(String body) {
            StringBuilder out = new StringBuilder(body.length() + 4);
            for (int i = 0; i < body.length(); i++) {
                char ch = body.charAt(i);
                if (ch == '\\' && i + 1 < body.length()) {
                    char next = body.charAt(i + 1);
                    if (next == '\'') {
                        out.append('\'');
                    } else {
                        out.append(ch).append(next);
                    }
                    i++;
                } else if (ch == '"') {
                    out.append("\\\"");
                } else {
                    out.append(ch);
                }
            }
            return out.toString();
        }

        private void emit(char c) {
            if (pendingSpace && current.length() > 0) {
                char previous = current.charAt(current.length() - 1);
                if ((isWordChar(previous) && isWordChar(c)) || fuses(previous, c)) {
                    current.append(' ');
                }
            }
            pendingSpace = false;
            current.append(c);
        }

        private void endLine() {
            if (current.length() > 0) {
                if (dialect.isLineStructured()) {
                    lines.add("\t".repeat(depthFor(indentWidth)) + current);
                } else {
                    lines.add(current.toString());
                }
            }
            current.setLength(0);
            indentWidth = 0;
            atLineStart = true;
            pendingSpace = false;
        }

        private int depthFor(int width) {
            while (!indentStack.isEmpty() && indentStack.peek() > width) {
                indentStack.pop();
            }
            if (indentStack.isEmpty() || indentStack.peek() < width) {
                indentStack.push(width);
            }
            return indentStack.size() - 1;
        }

        private static boolean fuses(char left, char right) {
            return FUSING_PAIRS.contains(String.valueOf(left) + right);
        }

        private static boolean isWordChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '$';
        }
    }
}
