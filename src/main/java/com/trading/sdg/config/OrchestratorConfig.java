package com.trading.sdg.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Runtime settings of the dataflow orchestrator. Readable from JSON; unknown
 * keys are ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrchestratorConfig {

    /** What a per-node failure does to the rest of the run. */
    public enum FailurePolicy {
        /** Only the failing asset's dependent nodes are skipped. */
        ISOLATE,
        /** The first failure stops the whole pipeline. */
        FAIL_FAST
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private int parallelism = Runtime.getRuntime().availableProcessors();
    private FailurePolicy failurePolicy = FailurePolicy.ISOLATE;
    private boolean progressSummaryEnabled = true;
    private long progressSummaryIntervalMillis = 100;
    private boolean asyncEvents = false;
    private int eventBufferSize = 1024;
    private long errorLogIntervalMillis = 1000;

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig load(Path path) throws IOException {
        return MAPPER.readValue(Files.readAllBytes(path), OrchestratorConfig.class).validate();
    }

    public static OrchestratorConfig parse(String json) throws IOException {
        return MAPPER.readValue(json, OrchestratorConfig.class).validate();
    }

    /**
     * @throws IllegalArgumentException on out-of-range values.
     */
    public OrchestratorConfig validate() {
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        if (Integer.bitCount(eventBufferSize) != 1)
            throw new IllegalArgumentException("eventBufferSize must be a power of two, got " + eventBufferSize);
        if (progressSummaryIntervalMillis < 0 || errorLogIntervalMillis < 0)
            throw new IllegalArgumentException("Intervals must not be negative");
        if (failurePolicy == null)
            throw new IllegalArgumentException("failurePolicy is required");
        return this;
    }
}
