package com.vgen.archive;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome recorded in an archive record. */
public enum ArchiveStatus {
    /** Accepted lines were appended to the content file. */
    WRITTEN("written"),
    /** Generation and validation completed but nothing was appended (dry run). */
    DRY_RUN("dry_run"),
    FAILED("failed");

    private final String value;

    ArchiveStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
