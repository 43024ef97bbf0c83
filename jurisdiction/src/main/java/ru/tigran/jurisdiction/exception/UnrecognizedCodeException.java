package ru.tigran.jurisdiction.exception;

/**
 * Thrown when text matches neither an alpha-2 nor an alpha-3 code.
 * The offending text is kept verbatim for diagnostics.
 */
public class UnrecognizedCodeException extends ApplicationException {
    private final String text;

    public UnrecognizedCodeException(String text) {
        super(ErrorCode.UNRECOGNIZED_CODE.getDefaultMessage() + ": " + text, ErrorCode.UNRECOGNIZED_CODE.getCode());
        this.text = text;
    }

    /**
     * @return the text that failed to parse, possibly null
     */
    public String getText() {
        return text;
    }
}
