package com.spendlens.backend.support;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import com.spendlens.backend.classification.custom.CustomCategoryStore;
import com.spendlens.backend.classification.entity.CustomCategory;
import com.spendlens.backend.exceptions.RegistryUnavailableException;

public class InMemoryCustomCategoryStore implements CustomCategoryStore {

    private final List<CustomCategory> rows = new ArrayList<>();
    private final AtomicInteger loads = new AtomicInteger();
    private volatile boolean down;

    public void setDown(boolean down) {
        this.down = down;
    }

    public int loads() {
        return loads.get();
    }

    @Override
    public synchronized List<CustomCategory> findActive() {
        check();
        loads.incrementAndGet();
        return rows.stream().filter(CustomCategory::isActive).toList();
    }

    @Override
    public synchronized List<CustomCategory> findAll() {
        check();
        return List.copyOf(rows);
    }

    @Override
    public synchronized boolean existsByName(String name) {
        check();
        return rows.stream().anyMatch(c -> c.getName().equalsIgnoreCase(name));
    }

    @Override
    public synchronized CustomCategory save(CustomCategory category) {
        check();
        if (category.getId() == null) category.setId(UUID.randomUUID());
        if (category.getCreatedAt() == null) category.setCreatedAt(LocalDateTime.now());
        rows.removeIf(c -> c.getId().equals(category.getId()));
        rows.add(category);
        return category;
    }

    private void check() {
        if (down) throw new RegistryUnavailableException("store is down", new IllegalStateException("down"));
    }
}
