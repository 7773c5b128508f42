package com.spendlens.backend.classification.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.spendlens.backend.classification.entity.CategoryCorrection;

public interface CategoryCorrectionRepository extends JpaRepository<CategoryCorrection, Long> {
    List<CategoryCorrection> findByPatternKeyOrderByCreatedAtDescIdDesc(String patternKey);

    Optional<CategoryCorrection> findFirstByPatternKeyOrderByCreatedAtDescIdDesc(String patternKey);
}
