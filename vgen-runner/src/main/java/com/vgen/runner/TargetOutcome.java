package com.vgen.runner;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** Result of one successfully processed target. */
public record TargetOutcome(TargetRef target, String contentKey, Path targetFile, List<String> acceptedVariants,
                            boolean written, Optional<Path> archiveFile) {

    public TargetOutcome {
        acceptedVariants = List.copyOf(acceptedVariants);
    }
}
