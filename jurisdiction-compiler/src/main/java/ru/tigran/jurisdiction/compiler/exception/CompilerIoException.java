package ru.tigran.jurisdiction.compiler.exception;

import java.io.IOException;

/**
 * Thrown when the dataset cannot be read or the generated sources cannot be written.
 */
public class CompilerIoException extends ApplicationException {
    public CompilerIoException(ErrorCode errorCode, String detail, IOException cause) {
        super(errorCode.getDefaultMessage() + ": " + detail, errorCode.getCode(), cause);
    }
}
