package com.assetsync.reconciler.exception;

/**
 * Exception thrown when a call to the inventory store fails.
 */
public class InventoryStoreException extends RuntimeException {

    public InventoryStoreException(String message) {
        super(message);
    }

    public InventoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
