package com.xedledom.registry;

import java.io.IOException;

/**
 * The registry file could not be written. Records and downloaded thumbnails are not rolled back.
 */
public class RegistryWriteException extends IOException {

    public RegistryWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
