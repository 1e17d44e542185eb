package com.xedledom.ids;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@code A0001}, {@code A0002}, ... in allocation order. Process-local, no uniqueness check.
 */
public final class SequentialIdAllocator implements IdAllocator {

    public static final String DEFAULT_PREFIX = "A";

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    public SequentialIdAllocator() {
        this(DEFAULT_PREFIX);
    }

    public SequentialIdAllocator(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public String next() {
        return prefix + String.format("%04d", counter.incrementAndGet());
    }
}
