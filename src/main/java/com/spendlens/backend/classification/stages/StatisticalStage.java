package com.spendlens.backend.classification.stages;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.ml.Prediction;
import com.spendlens.backend.classification.ml.StatisticalClassifier;
import com.spendlens.backend.classification.model.CategorizationMethod;
import com.spendlens.backend.classification.model.Transaction;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class StatisticalStage implements ClassificationStage {

    private final StatisticalClassifier classifier;

    @Override
    public String name() {
        return "ml";
    }

    @Override
    public Optional<StageDecision> evaluate(StageContext context) {
        if (context.getOptions().useLlmOnly()) return Optional.empty();

        Transaction tx = context.getTransaction();
        Prediction prediction = classifier.predict(tx.description(), tx.amount());
        context.setStatisticalCandidate(prediction);

        if (!prediction.hasCategory() || prediction.confidence() < context.getOptions().lowConfidenceThreshold()) {
            return Optional.empty();
        }

        return Optional.of(new StageDecision(
                prediction.category(),
                prediction.subcategory(),
                context.merchantHint(),
                CategorizationMethod.ML,
                prediction.confidence(),
                "Statistical match on " + prediction.evidence()
        ));
    }
}
