package org.dxworks.probconv.exception;

public class RenderException extends ProbconvException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
