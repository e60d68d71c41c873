package com.phillippitts.vibedj.exception;

/**
 * Thrown when the track catalog store cannot be queried.
 * Pick handling degrades to an empty shortlist when this occurs.
 */
public class CatalogUnavailableException extends VibeDjException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
