package com.spendlens.backend.controllers;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.dto.ApiResponse;
import com.spendlens.backend.dto.StatementAnalysisResponseDTO;
import com.spendlens.backend.dto.StatementParseResponseDTO;
import com.spendlens.backend.dto.StatementTextRequestDTO;
import com.spendlens.backend.services.statements.StatementAnalysisService;
import com.spendlens.backend.services.statements.StatementExtractionPipeline;
import com.spendlens.backend.services.statements.StatementUploadService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/statements")
@RequiredArgsConstructor
public class StatementController {

    private final StatementExtractionPipeline pipeline;
    private final StatementUploadService uploadService;
    private final StatementAnalysisService analysisService;
    private final ClassificationProperties properties;

    @PostMapping("/parse")
    public ResponseEntity<ApiResponse<StatementParseResponseDTO>> parse(@Valid @RequestBody StatementTextRequestDTO request) {
        StatementParseResponseDTO body = StatementParseResponseDTO.from(pipeline.parseStatement(request.text()));
        return ResponseEntity.ok(ApiResponse.success(body, body.count() + " transactions extracted"));
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<StatementParseResponseDTO>> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "password", required = false) String password
    ) {
        StatementParseResponseDTO body = StatementParseResponseDTO.from(uploadService.upload(file, password));
        return ResponseEntity.ok(ApiResponse.success(body, body.count() + " transactions extracted"));
    }

    @PostMapping("/analyze")
    public ResponseEntity<ApiResponse<StatementAnalysisResponseDTO>> analyze(@Valid @RequestBody StatementTextRequestDTO request) {
        StatementAnalysisResponseDTO body = StatementAnalysisResponseDTO.from(
                analysisService.analyze(request.text(), request.toBatchOptions(properties)));
        return ResponseEntity.ok(ApiResponse.success(body, body.results().size() + " transactions analyzed"));
    }
}
