package com.opentext.tasklist.model;

import java.nio.file.Path;

/**
 * Thrown when the store file exists but its content is not a valid task collection.
 * Not repaired automatically.
 */
public class CorruptStoreException extends StoreException {

    public CorruptStoreException(String message, Path path) {
        super(message, path, null);
    }

    public CorruptStoreException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }
}
