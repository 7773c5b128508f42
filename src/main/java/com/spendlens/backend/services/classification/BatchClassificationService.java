package com.spendlens.backend.services.classification;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.spendlens.backend.classification.model.ClassificationOptions;
import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.classification.rules.Taxonomy;
import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.services.chunking.BatchInferenceOutcome;
import com.spendlens.backend.services.chunking.ChunkErrorSummary;
import com.spendlens.backend.services.chunking.ChunkedInferenceOrchestrator;
import com.spendlens.backend.services.chunking.InferredClassification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies a list of transactions.
 *
 * Every record goes through the engine with the per-item inference call turned off. Records
 * still Uncategorized are then sent together through chunked batch inference. Invalid records
 * are rejected one by one and never abort the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchClassificationService {

    private final TransactionClassificationService classificationService;
    private final ChunkedInferenceOrchestrator orchestrator;
    private final ClassificationProperties properties;

    public BatchClassificationResult classifyBatch(List<Transaction> transactions, BatchOptions options) {
        if (transactions == null) {
            throw new InvalidInputException("transactions are required");
        }
        BatchOptions opts = options != null ? options
                : new BatchOptions(0, true, ClassificationOptions.from(properties));
        ClassificationOptions perRecord = opts.classification().withLlmFallback(false);

        Map<String, ClassificationResult> byId = new LinkedHashMap<>();
        Map<String, Transaction> accepted = new LinkedHashMap<>();
        List<RejectedRecord> rejected = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < transactions.size(); i++) {
            Transaction tx = transactions.get(i);
            String id = tx == null ? null : tx.id();
            if (id != null && !seen.add(id)) {
                rejected.add(new RejectedRecord(i, id, "Duplicate transaction id"));
                continue;
            }
            try {
                ClassificationResult r = classificationService.classify(tx, perRecord);
                byId.put(id, r);
                accepted.put(id, tx);
            } catch (InvalidInputException e) {
                rejected.add(new RejectedRecord(i, id, e.getMessage()));
            }
        }

        ChunkErrorSummary summary = null;
        List<Transaction> unresolved = new ArrayList<>();
        for (Map.Entry<String, ClassificationResult> e : byId.entrySet()) {
            ClassificationResult r = e.getValue();
            if (Taxonomy.UNCATEGORIZED.equals(r.getCategory()) && !r.isSplit()) {
                unresolved.add(accepted.get(e.getKey()));
            }
        }

        boolean inferenceAllowed = opts.useLlmChunked() && opts.classification().enableLlmFallback();
        if (!unresolved.isEmpty() && inferenceAllowed && orchestrator.isAvailable()) {
            BatchInferenceOutcome outcome = orchestrator.classifyBatch(unresolved, opts.chunkSize());
            summary = outcome.summary();

            Map<String, InferredClassification> inferredById = new HashMap<>();
            for (InferredClassification c : outcome.results()) {
                if (!c.fallback()) inferredById.putIfAbsent(c.transactionId(), c);
            }
            for (Map.Entry<String, InferredClassification> e : inferredById.entrySet()) {
                ClassificationResult base = byId.get(e.getKey());
                if (base == null) continue;
                byId.put(e.getKey(), classificationService.applyInference(
                        accepted.get(e.getKey()), e.getValue(), opts.classification(), base.getMerchantName()));
            }
            log.info("[Batch] Inference resolved {}/{} uncategorized records", inferredById.size(), unresolved.size());
        }

        log.info("[Batch] Classified {} records ({} rejected)", byId.size(), rejected.size());
        return new BatchClassificationResult(new ArrayList<>(byId.values()), rejected, summary);
    }
}
