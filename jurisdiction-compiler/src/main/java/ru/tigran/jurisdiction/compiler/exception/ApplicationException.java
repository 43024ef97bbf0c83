package ru.tigran.jurisdiction.compiler.exception;

/**
 * Base exception class for all compiler-specific exceptions.
 * Carries a stable error code next to the human readable message so build logs can be grepped.
 *
 * Every subtype is fatal: the compiler never produces a partial or degraded artifact.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;

    public ApplicationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApplicationException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
