package com.vgen.generation.validation;

public enum RejectionReason {
    EMPTY,
    UNBALANCED_PLACEHOLDER,
    TOO_MANY_BUBBLES,
    BUBBLE_TOO_LONG,
    PIPES_NOT_ALLOWED,
    BLOCKLISTED,
    PII,
    EMOJI,
    DUPLICATE_OF_EXISTING,
    DUPLICATE_IN_BATCH
}
