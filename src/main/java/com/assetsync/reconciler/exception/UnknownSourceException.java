package com.assetsync.reconciler.exception;

/**
 * Exception thrown when a source name matches no known source.
 */
public class UnknownSourceException extends RuntimeException {

    public UnknownSourceException(String sourceName) {
        super("Unknown source: " + sourceName);
    }
}
