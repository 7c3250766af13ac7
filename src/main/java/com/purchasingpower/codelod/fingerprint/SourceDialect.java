package com.purchasingpower.codelod.fingerprint;

import java.util.Locale;
import java.util.Set;

/**
 * Lexical rules the normalizer needs for a family of languages.
 */
public enum SourceDialect {

    /** Python: '#' comments, triple-quoted strings, significant indentation, ' and " interchangeable. */
    PYTHON("#", null, null, "'\"", "'\"", true, '\''),

    /** Ruby, shell, YAML, TOML: '#' comments, line structure matters, quote styles differ in meaning. */
    HASH_SCRIPT("#", null, null, "'\"", "", true, (char) 0),

    /** JavaScript / TypeScript: C comments, ' and " interchangeable, template literals kept verbatim. */
    ECMASCRIPT("//", "/*", "*/", "'\"`", "", false, '\''),

    /**
     * Java, C, C++, C#, Go, Rust, Kotlin, Swift, Scala, PHP: C comments, ' is a char literal,
     * {@code """} opens a text block whose incidental indentation is not part of its value.
     */
    C_FAMILY("//", "/*", "*/", "'\"", "\"", false, (char) 0);

    private static final Set<String> PYTHON_LANGUAGES = Set.of("python");
    private static final Set<String> HASH_LANGUAGES = Set.of("ruby", "bash", "yaml", "toml", "perl", "r");
    private static final Set<String> ECMASCRIPT_LANGUAGES = Set.of("javascript", "typescript");
    private static final Set<String> C_LANGUAGES = Set.of(
        "java", "c", "cpp", "c_sharp", "go", "rust", "kotlin", "swift", "scala", "php");

    private final String lineComment;
    private final String blockCommentStart;
    private final String blockCommentEnd;
    private final String quoteChars;
    private final String tripleQuoteChars;
    private final boolean lineStructured;
    private final char quoteToNormalize;

    SourceDialect(String lineComment, String blockCommentStart, String blockCommentEnd, String quoteChars,
                  String tripleQuoteChars, boolean lineStructured, char quoteToNormalize) {
        this.lineComment = lineComment;
        this.blockCommentStart = blockCommentStart;
        this.blockCommentEnd = blockCommentEnd;
        this.quoteChars = quoteChars;
        this.tripleQuoteChars = tripleQuoteChars;
        this.lineStructured = lineStructured;
        this.quoteToNormalize = quoteToNormalize;
    }

    public static SourceDialect forLanguage(String language) {
        if (language == null) {
            return PYTHON;
        }
        String lang = language.toLowerCase(Locale.ROOT);
        if (C_LANGUAGES.contains(lang)) {
            return C_FAMILY;
        }
        if (ECMASCRIPT_LANGUAGES.contains(lang)) {
            return ECMASCRIPT;
        }
        if (HASH_LANGUAGES.contains(lang)) {
            return HASH_SCRIPT;
        }
        return PYTHON;
    }

    public String lineComment() {
        return lineComment;
    }

    public String blockCommentStart() {
        return blockCommentStart;
    }

    public String blockCommentEnd() {
        return blockCommentEnd;
    }

    public boolean isQuote(char c) {
        return quoteChars.indexOf(c) >= 0;
    }

    /**
     * Whether three {@code quote} characters open a multi-line literal.
     */
    public boolean supportsTripleQuotes(char quote) {
        return tripleQuoteChars.indexOf(quote) >= 0;
    }

    /**
     * Whether a triple-quoted literal is a text block, whose common leading indentation
     * and opening line break are not part of its value.
     */
    public boolean stripsTextBlockIndent() {
        return this == C_FAMILY;
    }

    /**
     * Whether newlines and indentation depth are part of the program's structure.
     */
    public boolean isLineStructured() {
        return lineStructured;
    }

    /**
     * Quote character rewritten to '"', or 0 when quoting is left alone.
     */
    public char quoteToNormalize() {
        return quoteToNormalize;
    }
}
