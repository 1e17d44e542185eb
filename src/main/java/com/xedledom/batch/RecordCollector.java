package com.xedledom.batch;

import com.xedledom.civitai.model.ModelRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single owner of the run's registry map and counters. Safe to call from several workers.
 */
final class RecordCollector {

    private final Map<String, ModelRecord> records = new LinkedHashMap<>();
    private int succeeded;
    private int failed;

    synchronized void add(String id, ModelRecord record) {
        if (records.putIfAbsent(id, record) != null) {
            throw new IllegalStateException("Identifier allocated twice: " + id);
        }
        succeeded++;
    }

    synchronized void failed() {
        failed++;
    }

    synchronized int succeeded() {
        return succeeded;
    }

    synchronized int failedCount() {
        return failed;
    }

    synchronized Map<String, ModelRecord> snapshot() {
        return new LinkedHashMap<>(records);
    }
}
