package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.ServiceOffering;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, Long> {

    Optional<ServiceOffering> findByIdAndTenantId(Long id, String tenantId);
}
