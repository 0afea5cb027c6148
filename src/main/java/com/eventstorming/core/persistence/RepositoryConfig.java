package com.eventstorming.core.persistence;

import com.eventstorming.core.config.EventStormingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the {@link WorkshopRepository}.
 * <p>
 * Workshops are stored as JSON files unless {@code eventstorming.storage.type}
 * is {@code memory}, in which case an {@link InMemoryWorkshopRepository} is
 * used. State in memory is lost when the process exits.
 */
@Configuration
public class RepositoryConfig {

    private static final Logger log = LoggerFactory.getLogger(RepositoryConfig.class);

    @Bean
    public WorkshopRepository workshopRepository(EventStormingProperties properties,
                                                 ObjectMapper objectMapper,
                                                 SchemaMigrator migrator,
                                                 Clock clock) {
        var storage = properties.getStorage();
        if (storage.isInMemory()) {
            log.info("Using in-memory workshop repository (workshops will not persist across runs)");
            return new InMemoryWorkshopRepository(objectMapper, migrator, clock);
        }
        Path directory = Path.of(storage.getDirectory());
        log.info("Using file workshop repository at {}", directory);
        return new FileWorkshopRepository(directory, objectMapper, migrator, clock);
    }
}
