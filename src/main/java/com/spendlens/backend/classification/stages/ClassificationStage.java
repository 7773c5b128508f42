package com.spendlens.backend.classification.stages;

import java.util.Optional;

/**
 * One step of the rule, statistical, inference chain. The engine takes the first decision.
 */
public interface ClassificationStage {

    String name();

    Optional<StageDecision> evaluate(StageContext context);
}
