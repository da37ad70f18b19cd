package com.codescribe.analyzer.config;

import com.codescribe.tracer.TracerConfig;
import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the optional settings JSON passed with {@code --settings}.
 * Every field is optional; getters fall back to the tracer defaults.
 */
public class AnalyzerSettings {

    /** Wall-clock budget for one trace run (default: 5000). */
    @SerializedName("trace_timeout_millis")
    private Long traceTimeoutMillis;

    /** Line events recorded before a trace is aborted (default: 10000). */
    @SerializedName("max_trace_events")
    private Integer maxTraceEvents;

    /** Object graph depth rendered for a traced variable (default: 2). */
    @SerializedName("render_depth")
    private Integer renderDepth;

    /** Collection elements rendered before truncating (default: 10). */
    @SerializedName("max_collection_elements")
    private Integer maxCollectionElements;

    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings();
    }

    public long getTraceTimeoutMillis() {
        return traceTimeoutMillis != null ? traceTimeoutMillis : TracerConfig.defaults().timeoutMillis();
    }

    public int getMaxTraceEvents() {
        return maxTraceEvents != null ? maxTraceEvents : TracerConfig.defaults().maxEvents();
    }

    public int getRenderDepth() {
        return renderDepth != null ? renderDepth : TracerConfig.defaults().renderDepth();
    }

    public int getMaxCollectionElements() {
        return maxCollectionElements != null ? maxCollectionElements : TracerConfig.defaults().maxCollectionElements();
    }

    public TracerConfig toTracerConfig() {
        return new TracerConfig(getTraceTimeoutMillis(), getMaxTraceEvents(), getRenderDepth(), getMaxCollectionElements());
    }
}
