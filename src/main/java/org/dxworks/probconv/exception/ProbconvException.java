package org.dxworks.probconv.exception;

/**
 * Base class for the failures probconv reports as domain errors.
 * Anything else (I/O, library faults) is left to propagate as-is.
 */
public class ProbconvException extends RuntimeException {

    public ProbconvException(String message) {
        super(message);
    }

    public ProbconvException(String message, Throwable cause) {
        super(message, cause);
    }
}
