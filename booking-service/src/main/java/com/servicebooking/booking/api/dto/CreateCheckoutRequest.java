package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.CustomerInfo;
import com.servicebooking.booking.domain.model.TemporalKey;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.time.LocalDate;

public record CreateCheckoutRequest(
        @NotNull(message = "Service ID cannot be null")
        Long serviceId,

        LocalDate date,

        Instant start,

        Instant end,

        @NotBlank(message = "Customer name cannot be blank")
        @Size(max = 200)
        String customerName,

        @NotBlank(message = "Customer email cannot be blank")
        @Email(message = "Customer email must be a valid address")
        String customerEmail,

        @Size(max = 40)
        String customerPhone,

        boolean deposit
) {
    public TemporalKey temporalKey() {
        return TemporalKeyFields.toTemporalKey(date, start, end);
    }

    public CustomerInfo customer() {
        return new CustomerInfo(customerName, customerEmail, customerPhone);
    }
}
