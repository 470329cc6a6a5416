package org.dxworks.probconv.exception;

public class ParseException extends ProbconvException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
