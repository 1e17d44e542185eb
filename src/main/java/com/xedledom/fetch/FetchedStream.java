package com.xedledom.fetch;

import java.io.IOException;
import java.io.InputStream;

/**
 * Response of a single GET with its body already read in full. The caller must close it.
 */
public record FetchedStream(FetchStatus status, int statusCode, String contentType, InputStream body)
        implements AutoCloseable {

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }

    @Override
    public void close() throws IOException {
        if (body != null) {
            body.close();
        }
    }
}
