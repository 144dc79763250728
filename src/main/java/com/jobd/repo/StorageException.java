package com.jobd.repo;

/**
 * A backend failure while reading or writing jobs or executions.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
