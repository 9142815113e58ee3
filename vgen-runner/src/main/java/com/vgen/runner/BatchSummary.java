package com.vgen.runner;

import java.util.List;

/** Aggregate of a batch run; {@link #failed()} counts targets that threw. */
public record BatchSummary(List<TargetOutcome> succeeded, int failed, boolean aborted) {

    public BatchSummary {
        succeeded = List.copyOf(succeeded);
    }

    public int ok() {
        return succeeded.size();
    }

    /** 0 when every target succeeded, 1 otherwise. */
    public int exitCode() {
        return failed > 0 ? 1 : 0;
    }

    @Override
    public String toString() {
        return "ok=" + ok() + " fail=" + failed;
    }
}
