package com.codescribe.analyzer.graph;

import com.google.gson.annotations.SerializedName;

/**
 * Aggregate counts for a call graph. {@code sqlQueries} is null until a caller merges a query count in.
 */
public record GraphMetadata(
        @SerializedName("files")             int files,
        @SerializedName("defined_functions") int definedFunctions,
        @SerializedName("external_nodes")    int externalNodes,
        @SerializedName("edges")             int edges,
        @SerializedName("sql_queries")       Integer sqlQueries
) {
    public GraphMetadata withSqlQueries(int count) {
        return new GraphMetadata(files, definedFunctions, externalNodes, edges, count);
    }
}
