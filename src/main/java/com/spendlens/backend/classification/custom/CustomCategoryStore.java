package com.spendlens.backend.classification.custom;

import java.util.List;

import com.spendlens.backend.classification.entity.CustomCategory;

/**
 * Persistence for custom categories. Implementations throw
 * {@link com.spendlens.backend.exceptions.RegistryUnavailableException} when the store cannot be reached.
 */
public interface CustomCategoryStore {

    /** Active categories, oldest first. */
    List<CustomCategory> findActive();

    List<CustomCategory> findAll();

    boolean existsByName(String name);

    CustomCategory save(CustomCategory category);
}
