package com.servicebooking.booking.domain.model;

public record CustomerInfo(String name, String email, String phone) {
}
