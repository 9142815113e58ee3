package com.vgen.config;

/**
 * Thrown when a configuration document cannot be parsed. {@link #getLine()} is 1-based, or 0 when the
 * failure is not tied to a single line.
 */
public class ConfigParseException extends RuntimeException {

    private final int line;

    public ConfigParseException(int line, String message) {
        super(line > 0 ? "line " + line + ": " + message : message);
        this.line = line;
    }

    public ConfigParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
    }

    public int getLine() {
        return line;
    }
}
