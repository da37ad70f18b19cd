package com.codescribe.analyzer.queries;

import com.codescribe.analyzer.static_analysis.JavaSourceParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds string literals that look like SQL statements.
 *
 * Every string literal and text block is tested on its own. In a concatenation such as
 * {@code "SELECT * FROM t WHERE id = " + id} the literal operands are separate literals and
 * the non-literal operands are ignored. This is a keyword heuristic, not a SQL parser.
 */
public class EmbeddedQueryExtractor {

    static final Pattern SQL_KEYWORD = Pattern.compile(
        "\\b(SELECT|INSERT|UPDATE|DELETE|CREATE\\s+TABLE|ALTER\\s+TABLE|WITH\\s+|DROP\\s+TABLE|MERGE)\\b",
        Pattern.CASE_INSENSITIVE);

    static final int MIN_LENGTH = 6;

    private final JavaSourceParser parser = new JavaSourceParser();

    /**
     * @return trimmed query literals, deduplicated, in source order; empty if the source does not parse
     */
    public List<String> extract(String source) {
        CompilationUnit unit;
        try {
            unit = parser.parse(source).unit();
        } catch (JavaSourceParser.SourceParseException e) {
            return List.of();
        }

        List<LiteralStringValueExpr> literals = new ArrayList<>();
        literals.addAll(unit.findAll(StringLiteralExpr.class));
        literals.addAll(unit.findAll(TextBlockLiteralExpr.class));
        literals.sort(Comparator.comparing(l -> l.getBegin().orElseThrow()));

        Set<String> queries = new LinkedHashSet<>();
        for (LiteralStringValueExpr literal : literals) {
            String value = literal instanceof TextBlockLiteralExpr block
                ? block.asString()
                : ((StringLiteralExpr) literal).asString();
            String candidate = value.strip();
            if (looksLikeSql(candidate)) {
                queries.add(candidate);
            }
        }
        return new ArrayList<>(queries);
    }

    static boolean looksLikeSql(String text) {
        String stripped = text.strip();
        return stripped.length() >= MIN_LENGTH && SQL_KEYWORD.matcher(stripped).find();
    }
}
