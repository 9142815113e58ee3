package com.vgen.archive;

/** The node a record was produced for; {@code contentKey} and {@code targetFile} may be null on early failure. */
public record ArchiveTarget(String sequenceId, int messageId, String contentKey, String targetFile) {
}
