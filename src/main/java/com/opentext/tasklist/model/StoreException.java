package com.opentext.tasklist.model;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Base class for failures of the backing file itself.
 */
@Getter
public abstract class StoreException extends RuntimeException {

    private final Path path;

    protected StoreException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
