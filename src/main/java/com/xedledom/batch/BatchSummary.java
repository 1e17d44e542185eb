package com.xedledom.batch;

import com.xedledom.civitai.model.ModelRecord;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a batch run. {@code total} counts the entries that were processed.
 */
public record BatchSummary(int succeeded,
                           int failed,
                           int total,
                           Map<String, ModelRecord> registry,
                           boolean registryWritten,
                           Path registryPath) {

    public BatchSummary {
        registry = Collections.unmodifiableMap(new LinkedHashMap<>(registry == null ? Map.of() : registry));
    }
}
