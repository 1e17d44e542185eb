package com.xedledom.fetch;

/**
 * Outcome kind of a single GET attempt.
 */
public enum FetchStatus {
    SUCCESS,
    CLIENT_ERROR,
    SERVER_ERROR,
    RATE_LIMITED,
    TIMEOUT,
    NETWORK_ERROR;

    public static FetchStatus fromStatusCode(int code) {
        if (code == 200) return SUCCESS;
        if (code == 429) return RATE_LIMITED;
        if (code >= 500) return SERVER_ERROR;
        return CLIENT_ERROR;
    }
}
