package com.servicebooking.booking.domain.service;

import com.servicebooking.booking.domain.calendar.BusyIntervalSource;
import com.servicebooking.booking.domain.calendar.BusyIntervals;
import com.servicebooking.booking.domain.model.BlackoutInterval;
import com.servicebooking.booking.domain.model.TimeRange;
import com.servicebooking.booking.domain.model.UnavailableSet;
import com.servicebooking.booking.domain.repository.BlackoutIntervalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Combines operator blackouts with the external calendar's busy times into one
 * minimal set of disjoint unavailable intervals.
 *
 * Read-only and not transactional: the external calendar call may take up to its
 * timeout and must not hold a database connection meanwhile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlackoutCalendarMerger {

    private final BlackoutIntervalRepository blackoutRepository;
    private final BusyIntervalSource busyIntervalSource;
    private final TenantCalendarSettingsService settingsService;

    /**
     * @param rangeStart inclusive
     * @param rangeEnd   exclusive
     */
    public UnavailableSet mergeUnavailable(String tenantId, Instant rangeStart, Instant rangeEnd) {
        ZoneId zone = settingsService.zoneFor(tenantId);
        LocalDate fromDate = LocalDate.ofInstant(rangeStart, zone);
        LocalDate toDate = LocalDate.ofInstant(rangeEnd.minusNanos(1), zone);

        List<TimeRange> intervals = new ArrayList<>();
        for (BlackoutInterval blackout : blackoutRepository.findOverlapping(tenantId, fromDate, toDate, rangeStart, rangeEnd)) {
            intervals.add(blackout.toTimeRange(zone));
        }
        int blackoutCount = intervals.size();

        BusyIntervals busy = busyIntervalSource.fetchBusyIntervals(tenantId, rangeStart, rangeEnd);
        intervals.addAll(busy.intervals());

        List<TimeRange> merged = merge(intervals);
        log.debug("Tenant {} unavailable {} - {}: {} blackout(s), {} busy, {} merged, degraded={}",
                tenantId, rangeStart, rangeEnd, blackoutCount, busy.intervals().size(), merged.size(), busy.degraded());
        return new UnavailableSet(merged, busy.degraded());
    }

    /**
     * Standard interval merge: sort by start, sweep, and fold the next interval into the
     * current one while {@code next.start <= current.end} (overlapping or touching).
     */
    public static List<TimeRange> merge(Collection<TimeRange> intervals) {
        List<TimeRange> sorted = new ArrayList<>(intervals);
        sorted.sort(TimeRange.BY_START);

        List<TimeRange> merged = new ArrayList<>();
        TimeRange current = null;
        for (TimeRange next : sorted) {
            if (current == null) {
                current = next;
            } else if (!next.start().isAfter(current.end())) {
                if (next.end().isAfter(current.end())) {
                    current = new TimeRange(current.start(), next.end());
                }
            } else {
                merged.add(current);
                current = next;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }
}
