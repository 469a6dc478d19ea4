package com.mobilitycopilot.backend.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import com.mobilitycopilot.backend.domain.TransitStopEntity;

public interface TransitStopRepository extends JpaRepository<TransitStopEntity, Long> {}
