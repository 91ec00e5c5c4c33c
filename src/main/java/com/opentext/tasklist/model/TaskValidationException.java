package com.opentext.tasklist.model;

/**
 * Thrown when caller-supplied task fields break a record invariant, e.g. a blank title.
 */
public class TaskValidationException extends RuntimeException {

    public TaskValidationException(String message) {
        super(message);
    }
}
