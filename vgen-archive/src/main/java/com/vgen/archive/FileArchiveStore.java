package com.vgen.archive;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Writes each record as pretty-printed JSON to {@code <root>/yyyy/MM/dd/<epochMillis>_<hash>.json}, where
 * the date and millis come from the store's clock and the hash from {@link ArchiveHash#forTarget}.
 */
public final class FileArchiveStore implements ArchiveStore {

    private static final Logger log = LoggerFactory.getLogger(FileArchiveStore.class);

    private final Path root;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileArchiveStore(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Path write(ArchiveRecord record) throws IOException {
        long millis = clock.millis();
        LocalDate day = clock.instant().atZone(clock.getZone()).toLocalDate();
        Path dir = root.resolve(String.format("%04d", day.getYear()))
                .resolve(String.format("%02d", day.getMonthValue()))
                .resolve(String.format("%02d", day.getDayOfMonth()));
        Files.createDirectories(dir);
        Path file = dir.resolve(millis + "_" + ArchiveHash.forTarget(record.getTarget()) + ".json");
        mapper.writeValue(file.toFile(), record);
        log.debug("Archived {} to {}", record.getStatus().toValue(), file);
        return file;
    }
}
