package com.spendlens.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.spendlens.backend.classification.ml.NaiveBayesTransactionClassifier;
import com.spendlens.backend.classification.ml.StatisticalClassifier;
import com.spendlens.backend.classification.ml.TrainingCorpus;

@Configuration
public class ClassifierConfig {

    @Bean
    public StatisticalClassifier statisticalClassifier() {
        return new NaiveBayesTransactionClassifier(TrainingCorpus.SEED);
    }
}
