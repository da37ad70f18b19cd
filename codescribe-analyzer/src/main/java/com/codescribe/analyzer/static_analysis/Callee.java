package com.codescribe.analyzer.static_analysis;

/**
 * A call target as written in source.
 *
 * @param text source-like rendering of the callee expression, e.g. {@code repo.findAll} or {@code ArrayList}
 * @param name the invoked simple name, e.g. {@code findAll} or {@code ArrayList}
 */
public record Callee(String text, String name) {}
