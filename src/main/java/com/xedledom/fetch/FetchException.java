package com.xedledom.fetch;

import java.io.IOException;

/**
 * Every attempt of a fetch failed. Carries the last observed outcome.
 */
public class FetchException extends IOException {

    private final FetchResult lastResult;

    public FetchException(String message, FetchResult lastResult, Throwable cause) {
        super(message, cause);
        this.lastResult = lastResult;
    }

    public FetchResult getLastResult() {
        return lastResult;
    }

    public FetchStatus getStatus() {
        return lastResult == null ? FetchStatus.NETWORK_ERROR : lastResult.status();
    }
}
