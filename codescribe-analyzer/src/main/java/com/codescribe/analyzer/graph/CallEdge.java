package com.codescribe.analyzer.graph;

import com.google.gson.annotations.SerializedName;

import java.util.Comparator;

/** Directed caller to callee edge between node keys. Ordered by caller, then callee. */
public record CallEdge(
        @SerializedName("source") String caller,
        @SerializedName("target") String callee
) implements Comparable<CallEdge> {

    private static final Comparator<CallEdge> ORDER =
        Comparator.comparing(CallEdge::caller).thenComparing(CallEdge::callee);

    @Override
    public int compareTo(CallEdge other) {
        return ORDER.compare(this, other);
    }
}
