package com.vgen.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Processes targets one at a time. A failed target is logged and counted; with fail-fast the remaining
 * targets are skipped.
 */
public final class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final Function<TargetRef, TargetOutcome> processor;
    private final boolean failFast;
    private final boolean verbose;

    public BatchRunner(Function<TargetRef, TargetOutcome> processor, boolean failFast, boolean verbose) {
        this.processor = processor;
        this.failFast = failFast;
        this.verbose = verbose;
    }

    public BatchSummary run(List<TargetRef> targets) {
        List<TargetOutcome> succeeded = new ArrayList<>();
        int failed = 0;
        boolean aborted = false;
        for (int i = 0; i < targets.size(); i++) {
            TargetRef target = targets.get(i);
            log.info("Processing {}", target);
            try {
                TargetOutcome outcome = processor.apply(target);
                log.info("Generated {} variants for {}", outcome.acceptedVariants().size(), target);
                succeeded.add(outcome);
            } catch (RuntimeException e) {
                failed++;
                if (verbose) {
                    log.error("FAILED {}: {}", target, e.getMessage(), e);
                } else {
                    log.error("FAILED {}: {}", target, e.getMessage());
                    log.debug("Failure detail for {}", target, e);
                }
                if (failFast && i < targets.size() - 1) {
                    log.warn("fail_fast is set; skipping {} remaining target(s)", targets.size() - i - 1);
                    aborted = true;
                    break;
                }
            }
        }
        BatchSummary summary = new BatchSummary(succeeded, failed, aborted);
        log.info("Done. {}", summary);
        return summary;
    }
}
