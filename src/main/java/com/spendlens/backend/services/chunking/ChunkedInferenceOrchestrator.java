package com.spendlens.backend.services.chunking;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.classification.rules.DescriptionNormalizer;
import com.spendlens.backend.classification.rules.Taxonomy;
import com.spendlens.backend.config.AsyncExecutorConfig;
import com.spendlens.backend.config.ChunkingProperties;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.exceptions.SchemaValidationException;
import com.spendlens.backend.services.ai.InferenceProvider;
import com.spendlens.backend.services.ai.InferenceProviderSelector;
import com.spendlens.backend.services.ai.InferenceRequest;

import lombok.extern.slf4j.Slf4j;

/**
 * Splits large inputs into chunks, sends one inference call per chunk and merges the answers
 * back in input order.
 *
 * <ul>
 *     <li>Text mode ({@link #extractTransactions(String)}) turns statement text into transactions.</li>
 *     <li>Batch mode ({@link #classifyBatch(List, int)}) suggests categories for a list of transactions.</li>
 * </ul>
 *
 * The provider is picked once per call. Chunks run concurrently on the chunk dispatch executor
 * and share nothing but the provider client. A chunk gets at most two attempts, the second with
 * the strict prompt; a chunk that still fails is reported in the {@link ChunkErrorSummary} and
 * never aborts the others.
 */
@Slf4j
@Service
public class ChunkedInferenceOrchestrator {

    private static final int MAX_ATTEMPTS = 2;

    private final InferenceProviderSelector providerSelector;
    private final ChunkingProperties properties;
    private final Executor executor;

    public ChunkedInferenceOrchestrator(InferenceProviderSelector providerSelector,
                                        ChunkingProperties properties,
                                        @Qualifier(AsyncExecutorConfig.CHUNK_DISPATCH_EXECUTOR) Executor executor) {
        this.providerSelector = providerSelector;
        this.properties = properties;
        this.executor = executor;
    }

    public boolean isAvailable() {
        return providerSelector.anyConfigured();
    }

    // ---------------------------------------------------------------------
    // Text mode
    // ---------------------------------------------------------------------

    public TextExtractionOutcome extractTransactions(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new InvalidInputException("raw text is required");
        }

        Optional<InferenceProvider> selected = providerSelector.select();
        if (selected.isEmpty()) {
            log.warn("[Chunking] Text extraction skipped: no inference provider configured");
            return new TextExtractionOutcome(List.of(), ChunkErrorSummary.noProvider(), false);
        }
        InferenceProvider provider = selected.get();

        String text = rawText.trim();
        boolean chunked = text.length() > properties.getSingleCallCharCeiling();
        List<TextChunk> chunks = chunked
                ? new TextChunker(properties.getChunkSizeChars(), properties.getOverlapRecords()).chunk(text)
                : List.of(new TextChunk(0, text, 1));

        log.info("[Chunking] Text extraction start (provider={} chars={} chunks={})",
                provider.name(), text.length(), chunks.size());

        int total = chunks.size();
        List<ChunkResult<List<ExtractedRow>>> results = dispatch(chunks.size(), i -> {
            TextChunk chunk = chunks.get(i);
            return runChunk(provider, i, chunk.recordCount(),
                    strict -> PromptTemplates.textExtraction(chunk.text(), chunk.index(), total,
                            properties.getMaxOutputTokensText(), strict),
                    ChunkedInferenceOrchestrator::parseRows);
        }, chunks.stream().map(TextChunk::recordCount).toList());

        List<Transaction> merged = mergeRows(results);
        ChunkErrorSummary summary = summarize(results, provider.name());

        log.info("[Chunking] Text extraction done: {} transactions, {}/{} chunks failed",
                merged.size(), summary.failedChunks(), summary.totalChunks());
        return new TextExtractionOutcome(merged, summary, chunked);
    }

    /**
     * Concatenates chunk rows in chunk order. A row whose (date, normalized description, amount)
     * key already came out of an earlier chunk is an overlap copy and is dropped; identical rows
     * inside one chunk are real repeats and are kept.
     */
    static List<Transaction> mergeRows(List<ChunkResult<List<ExtractedRow>>> results) {
        List<Transaction> out = new ArrayList<>();
        Set<String> seenInEarlierChunks = new HashSet<>();

        for (ChunkResult<List<ExtractedRow>> r : results) {
            if (r.value() == null) continue;
            Set<String> keysThisChunk = new HashSet<>();
            for (ExtractedRow row : r.value()) {
                String key = row.dedupKey();
                if (seenInEarlierChunks.contains(key)) continue;
                keysThisChunk.add(key);
                out.add(new Transaction(String.format(Locale.ROOT, "LLM_%05d", out.size() + 1),
                        row.date(), row.narration(), row.signedAmount()));
            }
            seenInEarlierChunks.addAll(keysThisChunk);
        }
        return out;
    }

    static List<ExtractedRow> parseRows(String output) {
        List<JsonNode> nodes = JsonArrayExtractor.extract(output);
        List<ExtractedRow> rows = new ArrayList<>();
        int invalid = 0;
        for (JsonNode n : nodes) {
            ExtractedRow row = ExtractedRow.from(n);
            if (row == null) {
                invalid++;
            } else {
                rows.add(row);
            }
        }
        if (rows.isEmpty() && invalid > 0) {
            throw new SchemaValidationException("None of " + invalid + " extracted rows has date, amount and narration");
        }
        if (invalid > 0) {
            log.debug("[Chunking] Dropped {} invalid rows", invalid);
        }
        return rows;
    }

    // ---------------------------------------------------------------------
    // Batch mode
    // ---------------------------------------------------------------------

    public BatchInferenceOutcome classifyBatch(List<Transaction> transactions, int chunkSize) {
        if (transactions == null || transactions.isEmpty()) {
            return new BatchInferenceOutcome(List.of(), ChunkErrorSummary.none(0, null));
        }

        Optional<InferenceProvider> selected = providerSelector.select();
        if (selected.isEmpty()) {
            log.warn("[Chunking] Batch classification skipped: no inference provider configured");
            return new BatchInferenceOutcome(List.of(), ChunkErrorSummary.noProvider());
        }
        InferenceProvider provider = selected.get();

        List<Transaction> unique = dropDuplicateIds(transactions);
        int size = chunkSize > 0 ? chunkSize : properties.getChunkSizeItems();

        List<List<Transaction>> groups = new ArrayList<>();
        for (int start = 0; start < unique.size(); start += size) {
            groups.add(unique.subList(start, Math.min(start + size, unique.size())));
        }

        log.info("[Chunking] Batch classification start (provider={} items={} chunks={} chunkSize={})",
                provider.name(), unique.size(), groups.size(), size);

        List<ChunkResult<Map<Integer, InferredClassification>>> results = dispatch(groups.size(), i -> {
            List<Transaction> group = groups.get(i);
            return runChunk(provider, i, group.size(),
                    strict -> PromptTemplates.batchClassification(group, properties.getMaxOutputTokensBatch(), strict),
                    output -> parseClassifications(output, group));
        }, groups.stream().map(List::size).toList());

        ChunkErrorSummary summary = summarize(results, provider.name());
        if (summary.allFailed()) {
            log.warn("[Chunking] Batch classification: all {} chunks failed", summary.totalChunks());
            return new BatchInferenceOutcome(List.of(), summary);
        }

        List<InferredClassification> merged = new ArrayList<>(unique.size());
        for (int i = 0; i < groups.size(); i++) {
            List<Transaction> group = groups.get(i);
            Map<Integer, InferredClassification> byIndex = results.get(i).value();
            for (int j = 0; j < group.size(); j++) {
                InferredClassification c = byIndex == null ? null : byIndex.get(j);
                merged.add(c != null ? c : InferredClassification.fallback(group.get(j).id()));
            }
        }

        log.info("[Chunking] Batch classification done: {} items, {}/{} chunks failed",
                merged.size(), summary.failedChunks(), summary.totalChunks());
        return new BatchInferenceOutcome(merged, summary);
    }

    /**
     * Single-item inference used by the per-transaction fallback. Empty when the provider gave no
     * usable answer.
     */
    public Optional<InferredClassification> classifySingle(Transaction transaction) {
        BatchInferenceOutcome outcome = classifyBatch(List.of(transaction), 1);
        if (outcome.results().isEmpty()) return Optional.empty();
        InferredClassification c = outcome.results().get(0);
        return c.fallback() ? Optional.empty() : Optional.of(c);
    }

    static Map<Integer, InferredClassification> parseClassifications(String output, List<Transaction> group) {
        List<JsonNode> nodes = JsonArrayExtractor.extract(output);

        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < group.size(); i++) {
            indexById.putIfAbsent(group.get(i).id(), i);
        }

        Map<Integer, InferredClassification> out = new LinkedHashMap<>();
        for (JsonNode n : nodes) {
            Integer idx = null;
            if (n.hasNonNull("index") && n.get("index").canConvertToInt()) {
                idx = n.get("index").asInt();
            } else {
                String id = text(n, "transaction_id", "id");
                if (id != null) idx = indexById.get(id);
            }
            if (idx == null || idx < 0 || idx >= group.size() || out.containsKey(idx)) continue;

            String category = Taxonomy.canonicalCategory(text(n, "category")).orElse(null);
            String subcategory = category == null ? null
                    : Taxonomy.canonicalSubcategory(category, text(n, "subcategory")).orElse(text(n, "subcategory"));
            Double confidence = n.hasNonNull("confidence") && n.get("confidence").isNumber()
                    ? Math.max(0.0, Math.min(1.0, n.get("confidence").asDouble()))
                    : null;

            out.put(idx, new InferredClassification(group.get(idx).id(), category, subcategory,
                    text(n, "merchant_name", "merchantName"), confidence, false));
        }

        if (out.isEmpty()) {
            throw new SchemaValidationException("No classification in response matched the " + group.size() + " items sent");
        }
        return out;
    }

    private static List<Transaction> dropDuplicateIds(List<Transaction> transactions) {
        Set<String> seen = new HashSet<>();
        List<Transaction> out = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            if (!seen.add(tx.id())) {
                log.warn("[Chunking] Duplicate transaction id '{}' dropped from batch", tx.id());
                continue;
            }
            out.add(tx);
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------

    /**
     * Runs the chunks on the executor with at most {@code maxConcurrency} of them in flight and
     * collects the results in index order. Each chunk gets {@code chunkTimeoutSeconds} per attempt;
     * chunks finished before the global deadline are kept, the rest are reported as failed.
     */
    private <T> List<ChunkResult<T>> dispatch(int count, Function<Integer, ChunkResult<T>> task, List<Integer> itemCounts) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getGlobalDeadlineSeconds());
        long perChunkNanos = TimeUnit.SECONDS.toNanos((long) properties.getChunkTimeoutSeconds() * MAX_ATTEMPTS);
        Semaphore inFlight = new Semaphore(Math.max(1, properties.getMaxConcurrency()));

        List<CompletableFuture<ChunkResult<T>>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            futures.add(submit(i, task, itemCounts.get(i), inFlight, deadline, perChunkNanos));
        }

        List<ChunkResult<T>> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            results.add(await(i, futures.get(i), itemCounts.get(i), deadline));
        }
        return results;
    }

    private <T> CompletableFuture<ChunkResult<T>> submit(int index, Function<Integer, ChunkResult<T>> task, int itemCount,
                                                         Semaphore inFlight, long deadline, long perChunkNanos) {
        try {
            if (!inFlight.tryAcquire(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                return CompletableFuture.completedFuture(
                        ChunkResult.failed(index, itemCount, "Global deadline exceeded", 0));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.completedFuture(ChunkResult.failed(index, itemCount, "Interrupted", 0));
        }

        try {
            CompletableFuture<ChunkResult<T>> f = CompletableFuture
                    .supplyAsync(() -> task.apply(index), executor)
                    .orTimeout(perChunkNanos, TimeUnit.NANOSECONDS);
            f.whenComplete((r, e) -> inFlight.release());
            return f;
        } catch (RejectedExecutionException e) {
            inFlight.release();
            log.warn("[Chunking] Chunk {} rejected by executor: {}", index, e.getMessage());
            return CompletableFuture.completedFuture(ChunkResult.failed(index, itemCount, "Rejected by executor", 0));
        }
    }

    private <T> ChunkResult<T> await(int index, CompletableFuture<ChunkResult<T>> f, int itemCount, long deadline) {
        try {
            return f.get(Math.max(1, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("[Chunking] Chunk {} still running at the global deadline", index);
            return ChunkResult.failed(index, itemCount, "Global deadline exceeded", 0);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.warn("[Chunking] Chunk {} timed out", index);
                return ChunkResult.failed(index, itemCount, "Timed out", 0);
            }
            log.warn("[Chunking] Chunk {} crashed: {}", index, cause.toString());
            return ChunkResult.failed(index, itemCount, cause.toString(), 0);
        } catch (CancellationException e) {
            return ChunkResult.failed(index, itemCount, "Cancelled", 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return ChunkResult.failed(index, itemCount, "Interrupted", 0);
        }
    }

    private <T> ChunkResult<T> runChunk(InferenceProvider provider, int index, int itemCount,
                                        Function<Boolean, InferenceRequest> prompt,
                                        Function<String, T> parser) {
        String lastError = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            boolean strict = attempt > 1;
            long start = System.currentTimeMillis();
            try {
                String output = provider.infer(prompt.apply(strict));
                T value = parser.apply(output);
                log.debug("[Chunking] Chunk {} ok (attempt={} elapsedMs={})",
                        index, attempt, System.currentTimeMillis() - start);
                return ChunkResult.ok(index, value);
            } catch (RuntimeException e) {
                lastError = e.getMessage() != null ? e.getMessage() : e.toString();
                log.warn("[Chunking] Chunk {} failed (attempt={} strict={} elapsedMs={}): {}",
                        index, attempt, strict, System.currentTimeMillis() - start, lastError);
            }
        }
        return ChunkResult.failed(index, itemCount, lastError, MAX_ATTEMPTS);
    }

    private static <T> ChunkErrorSummary summarize(List<ChunkResult<T>> results, String provider) {
        List<ChunkFailure> failures = new ArrayList<>();
        for (ChunkResult<T> r : results) {
            if (r.failure() != null) failures.add(r.failure());
        }
        return new ChunkErrorSummary(results.size(), failures.size(), provider, failures);
    }

    private static String text(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && !v.isNull()) {
                String s = v.asText("").trim();
                if (!s.isEmpty() && !"null".equalsIgnoreCase(s)) return s;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Types
    // ---------------------------------------------------------------------

    record ChunkResult<T>(int index, T value, ChunkFailure failure) {

        static <T> ChunkResult<T> ok(int index, T value) {
            return new ChunkResult<>(index, value, null);
        }

        static <T> ChunkResult<T> failed(int index, int itemCount, String reason, int attempts) {
            return new ChunkResult<>(index, null, new ChunkFailure(index, itemCount, reason, attempts));
        }
    }

    /**
     * One row of text-mode output. Amount is the absolute value; the sign comes from {@code type}.
     */
    record ExtractedRow(LocalDate date, String narration, BigDecimal amount, boolean credit) {

        static ExtractedRow from(JsonNode n) {
            if (n == null || !n.isObject()) return null;

            LocalDate date;
            String rawDate = text(n, "date");
            if (rawDate == null) return null;
            try {
                date = LocalDate.parse(rawDate);
            } catch (DateTimeParseException e) {
                return null;
            }

            String narration = text(n, "narration", "description");
            if (narration == null) return null;

            BigDecimal amount = amount(n.get("amount"));
            if (amount == null || amount.signum() == 0) return null;

            String type = text(n, "type");
            boolean credit = type != null
                    ? type.toLowerCase(Locale.ROOT).startsWith("cr")
                    : amount.signum() < 0;
            return new ExtractedRow(date, narration, amount.abs(), credit);
        }

        private static BigDecimal amount(JsonNode v) {
            if (v == null || v.isNull()) return null;
            if (v.isNumber()) return v.decimalValue();
            String s = v.asText("").replace(",", "").replace("₹", "").trim();
            if (s.isEmpty()) return null;
            try {
                return new BigDecimal(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }

        BigDecimal signedAmount() {
            return credit ? amount.negate() : amount;
        }

        String dedupKey() {
            return date + "|" + DescriptionNormalizer.normalize(narration) + "|"
                    + signedAmount().setScale(2, RoundingMode.HALF_UP).toPlainString();
        }
    }
}
