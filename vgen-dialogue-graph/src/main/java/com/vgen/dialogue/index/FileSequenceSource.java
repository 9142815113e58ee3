package com.vgen.dialogue.index;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vgen.dialogue.model.SequenceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code <assets>/sequences/<sequenceId>.json}.
 */
public final class FileSequenceSource implements SequenceSource {

    private static final Logger log = LoggerFactory.getLogger(FileSequenceSource.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path sequencesDir;

    public FileSequenceSource(Path assetsRoot) {
        this.sequencesDir = assetsRoot.resolve("sequences");
    }

    public Path pathOf(String sequenceId) {
        return sequencesDir.resolve(sequenceId + ".json");
    }

    @Override
    public Optional<SequenceDocument> load(String sequenceId) {
        if (sequenceId == null || sequenceId.isBlank() || sequenceId.contains("/") || sequenceId.contains("\\")) {
            throw new SequenceLoadException("Invalid sequence id: '" + sequenceId + "'");
        }
        Path path = pathOf(sequenceId);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            SequenceDocument doc = MAPPER.readValue(path.toFile(), SequenceDocument.class);
            log.debug("Loaded sequence {} ({} messages) from {}", sequenceId, doc.getMessages().size(), path);
            return Optional.of(doc);
        } catch (IOException e) {
            throw new SequenceLoadException("Malformed sequence document " + path + ": " + e.getMessage(), e);
        }
    }
}
