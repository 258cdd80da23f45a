package com.delta.adsync.sync.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public record DateRange(LocalDate since, LocalDate until) {
    public DateRange {
        if (since == null || until == null) {
            throw new IllegalArgumentException("Date range bounds are required");
        }
        if (until.isBefore(since)) {
            throw new IllegalArgumentException("Date range ends before it starts: " + since + " > " + until);
        }
    }

    public long days() {
        return ChronoUnit.DAYS.between(since, until) + 1;
    }
}
