package com.mapsheet.collection.registry;

/**
 * Runtime exception thrown when reference data (the work-unit listing) cannot be read
 * or is malformed.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
