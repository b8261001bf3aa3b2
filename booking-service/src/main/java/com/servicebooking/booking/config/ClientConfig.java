package com.servicebooking.booking.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Kept off the application class so JPA test slices start without Feign.
 */
@Configuration
@EnableFeignClients(basePackages = "com.servicebooking.booking.client")
public class ClientConfig {
}
