package com.spendlens.backend.classification.repository;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.spendlens.backend.classification.entity.MerchantRuleEntry;

public interface MerchantRuleRepository extends JpaRepository<MerchantRuleEntry, UUID> {
    Optional<MerchantRuleEntry> findByPattern(String pattern);

    boolean existsByPattern(String pattern);
}
