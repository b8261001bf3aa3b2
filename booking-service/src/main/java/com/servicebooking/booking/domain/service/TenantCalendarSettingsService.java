package com.servicebooking.booking.domain.service;

import com.servicebooking.booking.domain.model.TenantCalendarSettings;
import com.servicebooking.booking.domain.repository.TenantCalendarSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Tenant-level calendar configuration: the zone used for all calendar-day arithmetic
 * and the id of the connected external calendar, if any.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantCalendarSettingsService {

    private final TenantCalendarSettingsRepository repository;

    @Value("${booking.default-timezone:UTC}")
    private String defaultTimezone;

    public ZoneId zoneFor(String tenantId) {
        String zone = repository.findById(tenantId)
                .map(TenantCalendarSettings::getTimezone)
                .orElse(defaultTimezone);
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Tenant {} has invalid timezone '{}', falling back to {}", tenantId, zone, defaultTimezone);
            return ZoneId.of(defaultTimezone);
        }
    }

    public Optional<String> findExternalCalendarId(String tenantId) {
        return repository.findById(tenantId)
                .map(TenantCalendarSettings::getExternalCalendarId)
                .filter(id -> !id.isBlank());
    }
}
