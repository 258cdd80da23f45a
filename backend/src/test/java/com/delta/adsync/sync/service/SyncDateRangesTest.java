package com.delta.adsync.sync.service;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.model.DateRange;
import com.delta.adsync.sync.model.SyncRunRequest;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SyncDateRangesTest {
    // 02:00 UTC is still the previous evening in Los Angeles
    private static final Instant NOW = Instant.parse("2024-05-10T02:00:00Z");

    private final AdSyncProperties properties = new AdSyncProperties();
    private final SyncDateRanges ranges = new SyncDateRanges(Clock.fixed(NOW, ZoneOffset.UTC), properties);

    @Test
    void dailyIsYesterdayInAccountTimezone() {
        assertEquals(
            new DateRange(LocalDate.of(2024, 5, 9), LocalDate.of(2024, 5, 9)),
            ranges.rangeFor(request("daily", null, null, null), "UTC")
        );
        assertEquals(
            new DateRange(LocalDate.of(2024, 5, 8), LocalDate.of(2024, 5, 8)),
            ranges.rangeFor(request("daily", null, null, null), "America/Los_Angeles")
        );
    }

    @Test
    void intradayIsToday() {
        DateRange range = ranges.rangeFor(request("intraday", null, null, null), "Europe/Berlin");
        assertEquals(LocalDate.of(2024, 5, 10), range.since());
        assertEquals(LocalDate.of(2024, 5, 10), range.until());
    }

    @Test
    void backfillIsClampedToConfiguredMaximum() {
        properties.getSync().setMaxDaysBack(30);

        DateRange range = ranges.rangeFor(request("backfill", 365, null, null), "UTC");

        assertEquals(LocalDate.of(2024, 4, 10), range.since());
        assertEquals(LocalDate.of(2024, 5, 10), range.until());
        assertEquals(LocalDate.of(2024, 5, 3), ranges.rangeFor(request("backfill", null, null, null), "UTC").since());
        assertEquals(LocalDate.of(2024, 5, 9), ranges.rangeFor(request("backfill", 0, null, null), "UTC").since());
    }

    @Test
    void explicitDatesWin() {
        DateRange range = ranges.rangeFor(
            request("daily", null, LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 3)),
            "UTC"
        );
        assertEquals(3L, range.days());

        DateRange openEnded = ranges.rangeFor(request("daily", null, LocalDate.of(2024, 5, 1), null), "UTC");
        assertEquals(LocalDate.of(2024, 5, 10), openEnded.until());
    }

    @Test
    void unknownTimezoneFallsBackToUtc() {
        assertEquals(ZoneOffset.UTC, SyncDateRanges.zoneOf("Mars/Olympus_Mons"));
        assertEquals(ZoneOffset.UTC, SyncDateRanges.zoneOf(null));
    }

    private static SyncRunRequest request(String mode, Integer daysBack, LocalDate from, LocalDate to) {
        return new SyncRunRequest("tenant-a", null, mode, daysBack, from, to, null, null, null);
    }
}
