package com.codescribe.analyzer.static_analysis;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

/**
 * Wrapper around JavaParser for syntax-only parsing. No symbol resolution is attempted.
 *
 * Source that is not a valid compilation unit is retried wrapped in a synthetic class body, so a bare
 * method or two pasted on their own still parse. The wrapper is opened on the first line, which keeps
 * line numbers intact; only columns on line 1 move by {@link #SNIPPET_PREFIX}'s length.
 */
public class JavaSourceParser {

    static final String SNIPPET_PREFIX = "class __Snippet { ";

    /**
     * @param unit          parsed tree
     * @param line1Shift    characters the wrapper added in front of line 1, 0 when not wrapped
     */
    public record ParsedSource(CompilationUnit unit, int line1Shift) {}

    public ParsedSource parse(String source) {
        ParseResult<CompilationUnit> direct = newParser().parse(source);
        if (direct.isSuccessful() && direct.getResult().isPresent()) {
            return new ParsedSource(direct.getResult().get(), 0);
        }

        ParseResult<CompilationUnit> wrapped = newParser().parse(SNIPPET_PREFIX + source + "\n}");
        if (wrapped.isSuccessful() && wrapped.getResult().isPresent()) {
            return new ParsedSource(wrapped.getResult().get(), SNIPPET_PREFIX.length());
        }

        String problem = direct.getProblems().isEmpty()
            ? "unknown parse error"
            : describe(direct.getProblems().get(0));
        throw new SourceParseException(problem);
    }

    private static JavaParser newParser() {
        // JavaParser instances are not thread-safe, one per parse
        return new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    private static String describe(Problem problem) {
        return problem.getVerboseMessage().strip();
    }

    public static class SourceParseException extends RuntimeException {
        public SourceParseException(String msg) { super(msg); }
    }
}
