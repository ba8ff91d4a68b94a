package com.sports.sync.core;

/**
 * Runtime exception thrown when synchronization input is malformed: a required
 * column is missing, provider tags are duplicated, a record has no identifier,
 * or contents of different entity types are mixed. Never retried internally.
 */
public class SyncConfigurationException extends RuntimeException {

    public SyncConfigurationException(String message) {
        super(message);
    }

    public SyncConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
