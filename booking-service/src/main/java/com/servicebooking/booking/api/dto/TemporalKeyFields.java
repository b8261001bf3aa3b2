package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.TemporalKey;
import com.servicebooking.common.exception.BusinessException;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Request bodies carry either {@code date} (DATE services) or {@code start}/{@code end}
 * (TIMESLOT services), never both.
 */
final class TemporalKeyFields {

    private TemporalKeyFields() {
    }

    static TemporalKey toTemporalKey(LocalDate date, Instant start, Instant end) {
        if (date != null && start == null && end == null) {
            return TemporalKey.ofDate(date);
        }
        if (date == null && start != null && end != null) {
            if (!end.isAfter(start)) {
                throw new BusinessException("Slot end must be after start", "INVALID_TEMPORAL_KEY");
            }
            return TemporalKey.ofSlot(start, end);
        }
        throw new BusinessException("Provide either a date or a start and end instant", "INVALID_TEMPORAL_KEY");
    }
}
