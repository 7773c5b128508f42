package com.spendlens.backend.services.ai;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.spendlens.backend.config.InferenceProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Picks the first configured provider in {@code spendlens.inference.provider-priority} order.
 */
@Slf4j
@Component
public class InferenceProviderSelector {

    private final List<InferenceProvider> ordered;

    public InferenceProviderSelector(List<InferenceProvider> providers, InferenceProperties inferenceProperties) {
        this.ordered = order(providers, inferenceProperties.getProviderPriority());
    }

    public Optional<InferenceProvider> select() {
        for (InferenceProvider p : ordered) {
            if (p.isConfigured()) return Optional.of(p);
        }
        return Optional.empty();
    }

    public boolean anyConfigured() {
        return select().isPresent();
    }

    private static List<InferenceProvider> order(List<InferenceProvider> providers, List<String> priority) {
        List<InferenceProvider> remaining = new ArrayList<>(providers == null ? List.of() : providers);
        List<InferenceProvider> out = new ArrayList<>();
        if (priority != null) {
            for (String name : priority) {
                if (name == null) continue;
                String wanted = name.trim().toLowerCase(Locale.ROOT);
                remaining.removeIf(p -> {
                    if (p.name().equalsIgnoreCase(wanted)) {
                        out.add(p);
                        return true;
                    }
                    return false;
                });
            }
        }
        // providers fora da lista de prioridade entram no fim
        out.addAll(remaining);
        log.debug("[Inference] Provider order: {}", out.stream().map(InferenceProvider::name).toList());
        return List.copyOf(out);
    }
}
