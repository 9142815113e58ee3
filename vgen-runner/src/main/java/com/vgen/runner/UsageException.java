package com.vgen.runner;

/** Command line cannot be interpreted; the run exits with status 2 after printing usage. */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }
}
