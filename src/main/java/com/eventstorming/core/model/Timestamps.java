package com.eventstorming.core.model;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Id and timestamp generation for workshop entities.
 * <p>
 * Timestamps are UTC with a fixed microsecond fraction so that string order
 * equals chronological order.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {}

    public static String now(Clock clock) {
        return FORMAT.format(clock.instant());
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }
}
