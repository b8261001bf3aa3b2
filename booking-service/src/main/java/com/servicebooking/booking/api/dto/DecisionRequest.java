package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.Decision;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record DecisionRequest(
        @NotNull(message = "Expected version cannot be null")
        @Positive
        Integer expectedVersion,

        @NotNull(message = "Decision cannot be null")
        Decision decision,

        @Size(max = 1000)
        String note,

        @NotBlank(message = "decidedBy cannot be blank")
        @Size(max = 100)
        String decidedBy
) {
}
