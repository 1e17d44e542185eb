package com.xedledom.batch;

import java.time.Duration;

/**
 * @param limit    process only the first {@code limit} entries; 0 processes all
 * @param workers  1 runs entries strictly one after another
 * @param delayMin lower bound of the pause after each successful entry
 * @param delayMax upper bound of that pause
 */
public record BatchOptions(int limit, int workers, Duration delayMin, Duration delayMax) {

    public static final BatchOptions DEFAULT = new BatchOptions(0, 1, Duration.ofMillis(600), Duration.ofMillis(1200));

    public BatchOptions {
        limit = Math.max(0, limit);
        workers = Math.max(1, workers);
        delayMin = delayMin == null || delayMin.isNegative() ? Duration.ZERO : delayMin;
        delayMax = delayMax == null || delayMax.compareTo(delayMin) < 0 ? delayMin : delayMax;
    }
}
