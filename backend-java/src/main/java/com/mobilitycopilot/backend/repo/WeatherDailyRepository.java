package com.mobilitycopilot.backend.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import com.mobilitycopilot.backend.domain.WeatherDailyEntity;

public interface WeatherDailyRepository extends JpaRepository<WeatherDailyEntity, Long> {}
