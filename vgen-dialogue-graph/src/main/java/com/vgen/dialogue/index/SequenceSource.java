package com.vgen.dialogue.index;

import com.vgen.dialogue.model.SequenceDocument;

import java.util.Optional;

/**
 * Supplies sequence documents by id. Implementations return empty when no document exists and throw
 * {@link SequenceLoadException} when one exists but cannot be read.
 */
public interface SequenceSource {

    Optional<SequenceDocument> load(String sequenceId);
}
