package com.xedledom.fetch;

import java.nio.charset.StandardCharsets;

/**
 * Result of one GET attempt. {@code statusCode} is 0 when no response arrived.
 */
public record FetchResult(FetchStatus status, int statusCode, byte[] body, String contentType) {

    public FetchResult {
        body = body == null ? new byte[0] : body;
        contentType = contentType == null ? "" : contentType;
    }

    public static FetchResult failure(FetchStatus status) {
        return new FetchResult(status, 0, null, null);
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
