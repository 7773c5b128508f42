package com.spendlens.backend.classification.custom;

import java.util.List;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.entity.CustomCategory;
import com.spendlens.backend.classification.repository.CustomCategoryRepository;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.exceptions.RegistryUnavailableException;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaCustomCategoryStore implements CustomCategoryStore {

    private final CustomCategoryRepository repository;

    @Override
    public List<CustomCategory> findActive() {
        try {
            return repository.findByActiveTrueOrderByCreatedAtAsc();
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to load custom categories", e);
        }
    }

    @Override
    public List<CustomCategory> findAll() {
        try {
            return repository.findAllByOrderByCreatedAtAsc();
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to load custom categories", e);
        }
    }

    @Override
    public boolean existsByName(String name) {
        try {
            return repository.existsByNameIgnoreCase(name);
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to read custom category '" + name + "'", e);
        }
    }

    @Override
    public CustomCategory save(CustomCategory category) {
        try {
            return repository.save(category);
        } catch (DataIntegrityViolationException race) {
            throw new InvalidInputException("Custom category '" + category.getName() + "' already exists");
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to save custom category '" + category.getName() + "'", e);
        }
    }
}
