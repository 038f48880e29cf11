package com.assetsync.reconciler.exception;

/**
 * Exception thrown when a source cannot be read (unreachable, auth failure).
 * Fatal to that source's run.
 */
public class AcquisitionException extends RuntimeException {

    public AcquisitionException(String message) {
        super(message);
    }

    public AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
