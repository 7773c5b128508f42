package com.spendlens.backend.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.spendlens.backend.classification.custom.CustomCategoryMatcher;
import com.spendlens.backend.classification.feedback.CorrectionService;
import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.classification.registry.MerchantRuleRegistry;
import com.spendlens.backend.classification.registry.RegistryRule;
import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.dto.ApiResponse;
import com.spendlens.backend.dto.BatchClassifyRequestDTO;
import com.spendlens.backend.dto.ClassificationOptionsDTO;
import com.spendlens.backend.dto.ClassifyRequestDTO;
import com.spendlens.backend.dto.CorrectionRequestDTO;
import com.spendlens.backend.dto.CorrectionResponseDTO;
import com.spendlens.backend.dto.CorrectionSubmitResponseDTO;
import com.spendlens.backend.dto.CustomCategoryRequestDTO;
import com.spendlens.backend.dto.CustomCategoryResponseDTO;
import com.spendlens.backend.dto.SmsClassificationResponseDTO;
import com.spendlens.backend.dto.SmsClassifyRequestDTO;
import com.spendlens.backend.services.classification.BatchClassificationResult;
import com.spendlens.backend.services.classification.BatchClassificationService;
import com.spendlens.backend.services.classification.TransactionClassificationService;
import com.spendlens.backend.services.statements.parsers.SmsAlertParser;
import com.spendlens.backend.services.statements.parsers.SmsBank;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/classification")
@RequiredArgsConstructor
public class ClassificationController {

    private final TransactionClassificationService classificationService;
    private final BatchClassificationService batchClassificationService;
    private final CorrectionService correctionService;
    private final MerchantRuleRegistry registry;
    private final CustomCategoryMatcher customCategoryMatcher;
    private final SmsAlertParser smsAlertParser;
    private final ClassificationProperties properties;

    @PostMapping("/classify")
    public ResponseEntity<ApiResponse<ClassificationResult>> classify(@Valid @RequestBody ClassifyRequestDTO request) {
        ClassificationResult result = classificationService.classify(
                request.transaction().toTransaction(),
                ClassificationOptionsDTO.resolve(request.options(), properties));
        return ResponseEntity.ok(ApiResponse.success(result, "Transaction classified"));
    }

    @PostMapping("/batch")
    public ResponseEntity<ApiResponse<BatchClassificationResult>> batch(@Valid @RequestBody BatchClassifyRequestDTO request) {
        BatchClassificationResult result = batchClassificationService.classifyBatch(
                request.toTransactions(), request.toBatchOptions(properties));
        return ResponseEntity.ok(ApiResponse.success(result,
                String.format("%d classified, %d rejected", result.results().size(), result.rejected().size())));
    }

    @PostMapping("/sms")
    public ResponseEntity<ApiResponse<SmsClassificationResponseDTO>> sms(@Valid @RequestBody SmsClassifyRequestDTO request) {
        Transaction tx = smsAlertParser.parse(request.sms(), SmsBank.from(request.bank()));
        ClassificationResult result = classificationService.classify(tx,
                ClassificationOptionsDTO.resolve(request.options(), properties));
        return ResponseEntity.ok(ApiResponse.success(new SmsClassificationResponseDTO(tx, result), "SMS classified"));
    }

    @PostMapping("/corrections")
    public ResponseEntity<ApiResponse<CorrectionSubmitResponseDTO>> correct(@Valid @RequestBody CorrectionRequestDTO request) {
        CorrectionSubmitResponseDTO body = CorrectionSubmitResponseDTO.from(correctionService.submit(request.toCommand()));
        return ResponseEntity.status(201).body(ApiResponse.success(body, "Correction recorded"));
    }

    @GetMapping("/corrections")
    public ResponseEntity<ApiResponse<List<CorrectionResponseDTO>>> corrections(
            @RequestParam(value = "description", required = false) String description,
            @RequestParam(value = "merchant", required = false) String merchant
    ) {
        List<CorrectionResponseDTO> history = correctionService.history(description, merchant).stream()
                .map(CorrectionResponseDTO::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(history, history.size() + " corrections"));
    }

    @GetMapping("/rules")
    public ResponseEntity<ApiResponse<List<RegistryRule>>> rules() {
        List<RegistryRule> rules = registry.listRules();
        return ResponseEntity.ok(ApiResponse.success(rules, rules.size() + " rules"));
    }

    @PostMapping("/custom-categories")
    public ResponseEntity<ApiResponse<CustomCategoryResponseDTO>> createCustomCategory(
            @Valid @RequestBody CustomCategoryRequestDTO request
    ) {
        CustomCategoryResponseDTO body = CustomCategoryResponseDTO.from(customCategoryMatcher.create(request.toCommand()));
        return ResponseEntity.status(201).body(ApiResponse.success(body, "Custom category created"));
    }

    @GetMapping("/custom-categories")
    public ResponseEntity<ApiResponse<List<CustomCategoryResponseDTO>>> customCategories() {
        List<CustomCategoryResponseDTO> categories = customCategoryMatcher.list().stream()
                .map(CustomCategoryResponseDTO::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(categories, categories.size() + " custom categories"));
    }
}
