package com.vgen.dialogue.index;

/**
 * A sequence document is missing or malformed, or a node address does not exist.
 */
public class SequenceLoadException extends RuntimeException {

    public SequenceLoadException(String message) {
        super(message);
    }

    public SequenceLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
