package com.eventstorming.core.persistence;

import com.eventstorming.core.model.NotFoundException;
import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopSummary;
import com.eventstorming.core.model.WorkshopValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores each workshop as {@code <id>.json} in one directory.
 * <p>
 * Writes go to a temporary file that is then moved over the target, so a
 * reader never sees a half-written snapshot.
 */
public class FileWorkshopRepository extends JsonWorkshopRepository {

    private static final Logger log = LoggerFactory.getLogger(FileWorkshopRepository.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;

    public FileWorkshopRepository(Path directory, ObjectMapper objectMapper, SchemaMigrator migrator, Clock clock) {
        super(objectMapper, migrator, clock);
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new WorkshopStorageException("Cannot create workshop directory " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    public Path pathOf(String workshopId) {
        if (workshopId == null || !SAFE_ID.matcher(workshopId).matches() || workshopId.contains("..")) {
            throw new WorkshopValidationException("Invalid workshop id: " + workshopId);
        }
        return directory.resolve(workshopId + SUFFIX);
    }

    @Override
    public Workshop load(String workshopId) {
        Path path = pathOf(workshopId);
        if (!Files.exists(path)) {
            throw new NotFoundException(NotFoundException.Kind.WORKSHOP, workshopId);
        }
        try {
            return decode(workshopId, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Failed to read workshop file {}", path, e);
            throw new WorkshopStorageException("Failed to read workshop " + workshopId, e);
        }
    }

    @Override
    public void save(Workshop workshop) {
        Path target = pathOf(workshop.getId());
        String json = encode(workshop);
        try {
            Path temp = Files.createTempFile(directory, workshop.getId(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved workshop {} to {}", workshop.getId(), target);
        } catch (IOException e) {
            log.error("Failed to write workshop file {}", target, e);
            throw new WorkshopStorageException("Failed to save workshop " + workshop.getId(), e);
        }
    }

    @Override
    public boolean exists(String workshopId) {
        return Files.exists(pathOf(workshopId));
    }

    @Override
    public List<WorkshopSummary> list() {
        List<WorkshopSummary> summaries = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path path : files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).toList()) {
                try {
                    summaries.add(summarize(Files.readString(path, StandardCharsets.UTF_8)));
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping unreadable workshop file {}: {}", path.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new WorkshopStorageException("Cannot list workshop directory " + directory, e);
        }
        summaries.sort(NEWEST_FIRST);
        return summaries;
    }
}
