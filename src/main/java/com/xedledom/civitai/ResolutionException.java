package com.xedledom.civitai;

/**
 * A link could not be turned into a record. Counted as one failed entry; the batch goes on.
 */
public class ResolutionException extends Exception {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
