package ru.tigran.jurisdiction.exception;

/**
 * Base exception class for all library-specific exceptions.
 * Provides a stable error code next to the message so callers can map failures without parsing text.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;

    public ApplicationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
