package com.servicebooking.booking.domain.calendar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicebooking.booking.client.CalendarClient;
import com.servicebooking.booking.client.dto.BusyIntervalResponse;
import com.servicebooking.booking.domain.model.TimeRange;
import com.servicebooking.booking.domain.service.TenantCalendarSettingsService;
import com.servicebooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads busy intervals from the tenant's connected calendar through {@link CalendarClient}.
 *
 * The remote call runs on {@code calendarExecutor} and is abandoned after
 * {@code booking.calendar.timeout-ms}; timeouts and errors yield a degraded empty result.
 * Successful reads are cached in Redis for a few minutes (best effort, never authoritative).
 */
@Slf4j
@Primary
@Component
@RequiredArgsConstructor
public class ExternalCalendarBusyIntervalSource implements BusyIntervalSource {

    private static final TypeReference<List<BusyIntervalResponse>> BUSY_LIST = new TypeReference<>() {
    };

    private final CalendarClient calendarClient;
    private final TenantCalendarSettingsService settingsService;
    private final NotConfiguredBusyIntervalSource notConfigured;
    private final ObjectMapper objectMapper;
    private final Executor calendarExecutor;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${booking.calendar.enabled:true}")
    private boolean enabled;

    @Value("${booking.calendar.timeout-ms:3000}")
    private long timeoutMs;

    @Value("${booking.calendar.cache-ttl-seconds:300}")
    private long cacheTtlSeconds;

    @Override
    public BusyIntervals fetchBusyIntervals(String tenantId, Instant from, Instant to) {
        Optional<String> calendarId = enabled ? settingsService.findExternalCalendarId(tenantId) : Optional.empty();
        if (calendarId.isEmpty()) {
            log.debug("No external calendar for tenant {}, using blackout data only", tenantId);
            return notConfigured.fetchBusyIntervals(tenantId, from, to);
        }

        String cacheKey = Constants.CACHE_BUSY_INTERVALS_PREFIX + tenantId + ":" + calendarId.get() + ":" + from + ":" + to;
        Optional<List<BusyIntervalResponse>> cached = readCache(cacheKey);
        if (cached.isPresent()) {
            return BusyIntervals.of(toRanges(cached.get()));
        }

        CompletableFuture<List<BusyIntervalResponse>> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> calendarClient.getBusyIntervals(calendarId.get(), from, to), calendarExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Calendar executor saturated, skipping external calendar for tenant {}", tenantId);
            return BusyIntervals.unavailable();
        }

        try {
            List<BusyIntervalResponse> busy = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            List<BusyIntervalResponse> safe = busy == null ? List.of() : busy;
            writeCache(cacheKey, safe);
            return BusyIntervals.of(toRanges(safe));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("External calendar for tenant {} did not answer within {} ms, availability degraded",
                    tenantId, timeoutMs);
            return BusyIntervals.unavailable();
        } catch (ExecutionException e) {
            log.warn("External calendar lookup failed for tenant {}, availability degraded: {}",
                    tenantId, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return BusyIntervals.unavailable();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while reading external calendar for tenant {}", tenantId);
            return BusyIntervals.unavailable();
        }
    }

    private List<TimeRange> toRanges(List<BusyIntervalResponse> busy) {
        return busy.stream()
                .filter(b -> b.start() != null && b.end() != null && b.end().isAfter(b.start()))
                .map(b -> new TimeRange(b.start(), b.end()))
                .toList();
    }

    private Optional<List<BusyIntervalResponse>> readCache(String cacheKey) {
        if (stringRedisTemplate == null) return Optional.empty();
        try {
            String json = stringRedisTemplate.opsForValue().get(cacheKey);
            if (json != null) {
                log.debug("Busy intervals served from cache: {}", cacheKey);
                return Optional.of(objectMapper.readValue(json, BUSY_LIST));
            }
        } catch (Exception e) {
            log.debug("Busy interval cache read missed or failed: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void writeCache(String cacheKey, List<BusyIntervalResponse> busy) {
        if (stringRedisTemplate == null) return;
        try {
            stringRedisTemplate.opsForValue().set(
                    cacheKey, objectMapper.writeValueAsString(busy), Duration.ofSeconds(cacheTtlSeconds));
        } catch (Exception e) {
            log.warn("Failed to cache busy intervals under {} (non-fatal)", cacheKey, e);
        }
    }
}
