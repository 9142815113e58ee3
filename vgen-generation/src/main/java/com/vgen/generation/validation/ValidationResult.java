package com.vgen.generation.validation;

import java.util.List;

/**
 * Accepted lines in candidate order, plus each rejected candidate with the first rule it failed.
 */
public record ValidationResult(List<String> accepted, List<Rejection> rejected) {

    public ValidationResult {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }

    public record Rejection(String candidate, RejectionReason reason) {
    }
}
