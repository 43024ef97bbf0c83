package ru.tigran.jurisdiction.compiler.exception;

/**
 * Enum for compiler error codes.
 * Centralizes all error code definitions to avoid magic strings.
 * Each code has a default message used as the prefix of the exception message.
 */
public enum ErrorCode {
    // Dataset consistency errors
    EMPTY_FEED("EMPTY_FEED", "Record feed contains no records"),
    DUPLICATE_COUNTRY_CODE("DUPLICATE_COUNTRY_CODE", "Numeric country code is not unique"),
    DUPLICATE_ALPHA2("DUPLICATE_ALPHA2", "Alpha-2 code is not unique"),
    DUPLICATE_ALPHA3("DUPLICATE_ALPHA3", "Alpha-3 code is not unique"),
    INVALID_ALPHA_CODE("INVALID_ALPHA_CODE", "Alpha code is not made of upper-case ASCII letters"),
    MALFORMED_NUMERIC_CODE("MALFORMED_NUMERIC_CODE", "Numeric code is not a valid unsigned 16-bit value"),
    IDENTIFIER_COLLISION("IDENTIFIER_COLLISION", "Classification names map to the same identifier"),
    TOO_MANY_CONSTANTS("TOO_MANY_CONSTANTS", "Generated enum would not fit in a single byte"),

    // I/O errors
    FEED_UNREADABLE("FEED_UNREADABLE", "Record feed could not be read"),
    OUTPUT_UNWRITABLE("OUTPUT_UNWRITABLE", "Generated sources could not be written");

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
