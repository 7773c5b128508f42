package com.spendlens.backend.classification.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.spendlens.backend.classification.entity.CustomCategory;

public interface CustomCategoryRepository extends JpaRepository<CustomCategory, UUID> {
    List<CustomCategory> findByActiveTrueOrderByCreatedAtAsc();

    List<CustomCategory> findAllByOrderByCreatedAtAsc();

    boolean existsByNameIgnoreCase(String name);
}
