package com.mobilitycopilot.backend.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import com.mobilitycopilot.backend.domain.CollisionEntity;

public interface CollisionRepository extends JpaRepository<CollisionEntity, Long> {}
