package com.spendlens.backend.classification.feedback;

import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.entity.CategoryCorrection;
import com.spendlens.backend.classification.repository.CategoryCorrectionRepository;
import com.spendlens.backend.exceptions.RegistryUnavailableException;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaCorrectionStore implements CorrectionStore {

    private final CategoryCorrectionRepository repository;

    @Override
    public CategoryCorrection append(CategoryCorrection correction) {
        if (correction.getId() != null) {
            throw new IllegalArgumentException("corrections are append-only");
        }
        try {
            return repository.save(correction);
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to append correction for '" + correction.getPatternKey() + "'", e);
        }
    }

    @Override
    public List<CategoryCorrection> history(String patternKey) {
        try {
            return repository.findByPatternKeyOrderByCreatedAtDescIdDesc(patternKey);
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to read corrections for '" + patternKey + "'", e);
        }
    }

    @Override
    public Optional<CategoryCorrection> latest(String patternKey) {
        try {
            return repository.findFirstByPatternKeyOrderByCreatedAtDescIdDesc(patternKey);
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to read corrections for '" + patternKey + "'", e);
        }
    }
}
