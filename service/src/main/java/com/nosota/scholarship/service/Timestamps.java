package com.nosota.scholarship.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps are truncated to microseconds, the precision the database keeps, so a value
 * read back equals the value written.
 */
final class Timestamps {

    private Timestamps() {
    }

    static LocalDateTime now(Clock clock) {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
