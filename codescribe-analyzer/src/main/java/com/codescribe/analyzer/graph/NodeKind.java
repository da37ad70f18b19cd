package com.codescribe.analyzer.graph;

import com.google.gson.annotations.SerializedName;

public enum NodeKind {
    /** Backed by a method or constructor found in the analysed sources. */
    @SerializedName("defined") DEFINED,
    /** Called but never defined in the analysed sources. */
    @SerializedName("external") EXTERNAL
}
