package com.xedledom.links;

import java.io.IOException;

/**
 * The link file is missing, unreadable or not a JSON object. Fatal for the run.
 */
public class LinkLoadException extends IOException {

    public LinkLoadException(String message) {
        super(message);
    }

    public LinkLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
