package com.delta.adsync.sync.service;

import com.delta.adsync.config.AdSyncProperties;
import com.delta.adsync.sync.model.DateRange;
import com.delta.adsync.sync.model.SyncMode;
import com.delta.adsync.sync.model.SyncRunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Computes a job's date range in the account's own timezone. */
@Component
public class SyncDateRanges {
    private static final Logger log = LoggerFactory.getLogger(SyncDateRanges.class);

    private final Clock clock;
    private final AdSyncProperties properties;

    public SyncDateRanges(Clock clock, AdSyncProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Explicit bounds in the request win. Otherwise daily is yesterday, intraday is today and
     * backfill is today minus {@code daysBack} through today.
     */
    public DateRange rangeFor(SyncRunRequest request, String timezoneName) {
        LocalDate today = LocalDate.now(clock.withZone(zoneOf(timezoneName)));
        if (request.dateFrom() != null || request.dateTo() != null) {
            LocalDate from = request.dateFrom() != null ? request.dateFrom() : request.dateTo();
            LocalDate to = request.dateTo() != null ? request.dateTo() : today;
            return new DateRange(from, to);
        }
        SyncMode mode = request.syncMode();
        if (mode == SyncMode.INTRADAY) {
            return new DateRange(today, today);
        }
        if (mode == SyncMode.BACKFILL) {
            return new DateRange(today.minusDays(daysBack(request.daysBack())), today);
        }
        return new DateRange(today.minusDays(1), today.minusDays(1));
    }

    private int daysBack(Integer requested) {
        int days = requested == null ? properties.getSync().getDefaultDaysBack() : requested;
        return Math.min(Math.max(1, days), properties.getSync().getMaxDaysBack());
    }

    static ZoneId zoneOf(String timezoneName) {
        if (timezoneName == null || timezoneName.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezoneName.trim());
        } catch (DateTimeException e) {
            log.warn("Unknown account timezone {}, using UTC", timezoneName);
            return ZoneOffset.UTC;
        }
    }
}
