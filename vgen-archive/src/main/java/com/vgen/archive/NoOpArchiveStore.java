package com.vgen.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/** Used when {@code io.archive_dir} is blank: records are logged, not stored. */
public final class NoOpArchiveStore implements ArchiveStore {

    private static final Logger log = LoggerFactory.getLogger(NoOpArchiveStore.class);

    @Override
    public Path write(ArchiveRecord record) {
        log.info("Archive (no-op): {}:{} status={} | persistence skipped (no archive_dir)",
                record.getTarget().sequenceId(), record.getTarget().messageId(), record.getStatus().toValue());
        return null;
    }
}
