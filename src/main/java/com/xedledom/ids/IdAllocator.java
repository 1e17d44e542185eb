package com.xedledom.ids;

/**
 * Hands out record identifiers for one run. Implementations are safe to share between workers.
 */
public interface IdAllocator {

    String next();
}
