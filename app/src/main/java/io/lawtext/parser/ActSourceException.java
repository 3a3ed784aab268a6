package io.lawtext.parser;

/**
 * Runtime exception raised when an act's source text or identity record cannot be read.
 */
public class ActSourceException extends RuntimeException {

    public ActSourceException(String message) {
        super(message);
    }

    public ActSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
