package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.TenantCalendarSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TenantCalendarSettingsRepository extends JpaRepository<TenantCalendarSettings, String> {
}
