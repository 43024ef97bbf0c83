package ru.tigran.jurisdiction.exception;

/**
 * Enum for library error codes.
 * Each code has a default message used as the prefix of the exception message.
 */
public enum ErrorCode {
    UNRECOGNIZED_CODE("UNRECOGNIZED_CODE", "Unrecognized ISO 3166 alpha country code");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
