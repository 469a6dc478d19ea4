package com.mobilitycopilot.backend.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import com.mobilitycopilot.backend.domain.ServiceRequestEntity;

public interface ServiceRequestRepository extends JpaRepository<ServiceRequestEntity, Long> {}
