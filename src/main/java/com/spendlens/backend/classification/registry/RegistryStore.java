package com.spendlens.backend.classification.registry;

import java.util.List;
import java.util.Optional;

import com.spendlens.backend.classification.entity.MerchantRuleEntry;

/**
 * Key-value access to merchant rules by loose-normalized pattern.
 *
 * Implementations throw {@link com.spendlens.backend.exceptions.RegistryUnavailableException}
 * when the backing store cannot be reached.
 */
public interface RegistryStore {

    Optional<MerchantRuleEntry> findByPattern(String pattern);

    List<MerchantRuleEntry> findAll();

    /**
     * Single-row insert-or-update keyed on {@link MerchantRuleEntry#getPattern()}.
     */
    MerchantRuleEntry upsert(MerchantRuleEntry entry);

    /**
     * Inserts the entry only when no rule exists for its pattern.
     *
     * @return true when a row was written
     */
    boolean insertIfAbsent(MerchantRuleEntry entry);
}
