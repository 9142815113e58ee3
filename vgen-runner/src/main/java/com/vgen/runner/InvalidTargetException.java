package com.vgen.runner;

/**
 * A target cannot be processed: malformed target line, or the node has a missing or malformed content key.
 */
public class InvalidTargetException extends RuntimeException {

    public InvalidTargetException(String message) {
        super(message);
    }
}
