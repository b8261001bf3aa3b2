package com.servicebooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "tenant_calendar_settings")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantCalendarSettings {
    @Id
    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    /** IANA zone id, e.g. America/New_York. */
    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    /** Connected external calendar; null when the tenant has not connected one. */
    @Column(name = "external_calendar_id", length = 255)
    private String externalCalendarId;
}
