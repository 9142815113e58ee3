package com.vgen.archive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists archive records. {@link ArchiveLedger} wraps calls so a failing store never fails a target.
 */
public interface ArchiveStore {

    /** @return where the record was written, or null when the store does not persist */
    Path write(ArchiveRecord record) throws IOException;
}
