package com.codescribe.analyzer.static_analysis;

/**
 * A path-like name paired with the source text read from it.
 * The path is relative and slash-separated in project mode, synthetic in single-file mode.
 */
public record SourceUnit(String path, String text) {

    public static final String SNIPPET = "<snippet>";

    public static SourceUnit snippet(String text) {
        return new SourceUnit(SNIPPET, text);
    }
}
