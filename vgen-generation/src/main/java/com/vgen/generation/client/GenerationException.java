package com.vgen.generation.client;

/**
 * Generation failed: missing credential, retries exhausted, or a response without variants.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
