package com.vgen.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Fail-safe facade over an {@link ArchiveStore}. A store failure is logged and reported as an empty
 * result; the target being archived is never failed because of it.
 */
public final class ArchiveLedger {

    private static final Logger log = LoggerFactory.getLogger(ArchiveLedger.class);

    private final ArchiveStore store;

    public ArchiveLedger(ArchiveStore store) {
        this.store = store != null ? store : new NoOpArchiveStore();
    }

    public Optional<Path> record(ArchiveRecord record) {
        try {
            return Optional.ofNullable(store.write(record));
        } catch (Exception e) {
            log.warn("Archive write failed ({}:{}); processing continues. Error: {}",
                    record.getTarget().sequenceId(), record.getTarget().messageId(), e.getMessage(), e);
            return Optional.empty();
        }
    }
}
