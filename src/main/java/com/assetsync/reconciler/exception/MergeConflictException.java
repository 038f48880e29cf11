package com.assetsync.reconciler.exception;

import lombok.Getter;

/**
 * Exception thrown when an incoming value does not fit the stored shape of its field.
 */
@Getter
public class MergeConflictException extends RuntimeException {

    private final String fieldName;

    public MergeConflictException(String fieldName, String message) {
        super("Field '" + fieldName + "': " + message);
        this.fieldName = fieldName;
    }
}
