package com.opentext.tasklist.model;

import java.nio.file.Path;

/**
 * Thrown when persisting the task collection fails. The previously committed file is left as it was.
 */
public class StoreWriteException extends StoreException {

    public StoreWriteException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }
}
