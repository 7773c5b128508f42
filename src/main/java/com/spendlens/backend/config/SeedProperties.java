package com.spendlens.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "spendlens.seed")
public class SeedProperties {

    /** Insert the built-in merchant rules at startup. */
    private boolean enabled = true;
}
