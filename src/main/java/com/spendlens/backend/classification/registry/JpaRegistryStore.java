package com.spendlens.backend.classification.registry;

import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.entity.MerchantRuleEntry;
import com.spendlens.backend.classification.repository.MerchantRuleRepository;
import com.spendlens.backend.exceptions.RegistryUnavailableException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaRegistryStore implements RegistryStore {

    private final MerchantRuleRepository repository;

    @Override
    public Optional<MerchantRuleEntry> findByPattern(String pattern) {
        try {
            return repository.findByPattern(pattern);
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to read rule '" + pattern + "'", e);
        }
    }

    @Override
    public List<MerchantRuleEntry> findAll() {
        try {
            return repository.findAll();
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to load merchant rules", e);
        }
    }

    @Override
    public MerchantRuleEntry upsert(MerchantRuleEntry entry) {
        try {
            return writeOnce(entry);
        } catch (DataIntegrityViolationException race) {
            // outro writer inseriu o mesmo pattern entre o find e o save
            log.debug("[Registry] Concurrent insert for pattern='{}', retrying as update", entry.getPattern());
            try {
                return writeOnce(entry);
            } catch (DataAccessException e) {
                throw new RegistryUnavailableException("Failed to upsert rule '" + entry.getPattern() + "'", e);
            }
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to upsert rule '" + entry.getPattern() + "'", e);
        }
    }

    @Override
    public boolean insertIfAbsent(MerchantRuleEntry entry) {
        try {
            if (repository.existsByPattern(entry.getPattern())) {
                return false;
            }
            repository.save(entry);
            return true;
        } catch (DataIntegrityViolationException race) {
            return false;
        } catch (DataAccessException e) {
            throw new RegistryUnavailableException("Failed to insert rule '" + entry.getPattern() + "'", e);
        }
    }

    private MerchantRuleEntry writeOnce(MerchantRuleEntry entry) {
        MerchantRuleEntry target = repository.findByPattern(entry.getPattern())
                .orElseGet(() -> MerchantRuleEntry.builder().pattern(entry.getPattern()).build());
        target.setCategory(entry.getCategory());
        target.setSubcategory(entry.getSubcategory());
        target.setMerchantName(entry.getMerchantName());
        target.setConfidence(entry.getConfidence());
        target.setSource(entry.getSource());
        return repository.save(target);
    }
}
