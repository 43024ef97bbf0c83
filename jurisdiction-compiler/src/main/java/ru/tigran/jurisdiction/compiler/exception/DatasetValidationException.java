package ru.tigran.jurisdiction.compiler.exception;

/**
 * Thrown when the record feed is malformed or inconsistent.
 * Examples: duplicate numeric country code, alpha code used twice, region code outside the u16 range.
 * Aborts the build.
 */
public class DatasetValidationException extends ApplicationException {
    public DatasetValidationException(ErrorCode errorCode, String detail) {
        super(errorCode.getDefaultMessage() + ": " + detail, errorCode.getCode());
    }
}
