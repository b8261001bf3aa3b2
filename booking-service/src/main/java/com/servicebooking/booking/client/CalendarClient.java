package com.servicebooking.booking.client;

import com.servicebooking.booking.client.dto.BusyIntervalResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.time.Instant;
import java.util.List;

/**
 * Feign client for the external calendar collaborator (free/busy lookups).
 */
@FeignClient(name = "calendar-service", url = "${booking.clients.calendar.url}", path = "/api/v1/calendars")
public interface CalendarClient {

    @GetMapping("/{calendarId}/busy")
    List<BusyIntervalResponse> getBusyIntervals(@PathVariable("calendarId") String calendarId,
                                                @RequestParam("from") Instant from,
                                                @RequestParam("to") Instant to);
}
