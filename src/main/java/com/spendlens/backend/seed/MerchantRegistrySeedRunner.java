package com.spendlens.backend.seed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.registry.MerchantRuleRegistry;
import com.spendlens.backend.config.SeedProperties;
import com.spendlens.backend.exceptions.RegistryUnavailableException;

/**
 * Loads the built-in merchant aliases into the registry at startup.
 * Patterns that already exist (seeded earlier or learned from corrections) are kept as they are.
 */
@Component
public class MerchantRegistrySeedRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(MerchantRegistrySeedRunner.class);

    private final MerchantRuleRegistry registry;
    private final SeedProperties seedProperties;

    public MerchantRegistrySeedRunner(MerchantRuleRegistry registry, SeedProperties seedProperties) {
        this.registry = registry;
        this.seedProperties = seedProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!seedProperties.isEnabled()) {
            logger.info("[Seed] Merchant seed disabled. Skipping.");
            return;
        }

        try {
            int inserted = registry.seedDefaults();
            logger.info("[Seed] Merchant registry ensured: {} new seed rules", inserted);
        } catch (RegistryUnavailableException e) {
            // sobe mesmo assim: o motor roda em modo degradado sem o registry
            logger.warn("[Seed] Merchant registry unavailable, seed skipped: {}", e.getMessage());
        }
    }
}
