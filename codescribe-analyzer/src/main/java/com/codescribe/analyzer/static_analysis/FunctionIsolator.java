package com.codescribe.analyzer.static_analysis;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.body.CallableDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cuts the original source text of one method or constructor out of a unit, so it can be handed on by itself.
 */
public class FunctionIsolator {

    private final JavaSourceParser parser = new JavaSourceParser();

    /**
     * Returns the text of the first method or constructor named {@code name}, in source order,
     * exactly as written (annotations and modifiers included, leading Javadoc excluded).
     * Empty when the name is blank, the source does not parse, or nothing matches.
     */
    public Optional<String> isolate(String source, String name) {
        if (name == null || name.isBlank()) return Optional.empty();

        JavaSourceParser.ParsedSource parsed;
        try {
            parsed = parser.parse(source);
        } catch (JavaSourceParser.SourceParseException e) {
            return Optional.empty();
        }

        Optional<Range> range = parsed.unit().findAll(CallableDeclaration.class).stream()
            .filter(c -> c.getNameAsString().equals(name))
            .map(c -> c.getRange())
            .flatMap(Optional::stream)
            .min((a, b) -> a.begin.compareTo(b.begin));
        if (range.isEmpty()) return Optional.empty();

        List<Integer> lineStarts = lineStarts(source);
        int begin = offset(lineStarts, range.get().begin, parsed.line1Shift());
        int end = offset(lineStarts, range.get().end, parsed.line1Shift()) + 1;
        return Optional.of(source.substring(begin, Math.min(end, source.length())));
    }

    private static int offset(List<Integer> lineStarts, Position position, int line1Shift) {
        int column = position.column - 1;
        if (position.line == 1) column -= line1Shift;
        return lineStarts.get(position.line - 1) + column;
    }

    /** Offsets of each line start. \r\n, \r and \n all end a line, as in the parser. */
    private static List<Integer> lineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') i++;
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        return starts;
    }
}
