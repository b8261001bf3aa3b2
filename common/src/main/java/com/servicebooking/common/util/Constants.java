package com.servicebooking.common.util;

/**
 * Keys and headers shared across the booking engine.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

    public static final String LOCK_SLOT_PREFIX = "lock:slot:";
    public static final String CACHE_IDEMPOTENCY_PREFIX = "idempotency:";
    public static final String CACHE_BUSY_INTERVALS_PREFIX = "calendar:busy:";

    public static final String TOPIC_BOOKING_CONFIRMED = "booking-confirmed";
    public static final String TOPIC_BOOKING_CANCELLED = "booking-cancelled";
}
