package com.spendlens.backend.classification.entity;

import java.time.LocalDateTime;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A user correction. Rows are append-only: there are no setters and every column is
 * non-updatable. A newer row for the same pattern key supersedes older ones.
 */
@Entity
@Table(name = "category_correction", indexes = @Index(name = "idx_category_correction_key", columnList = "pattern_key"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CategoryCorrection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", updatable = false)
    private String transactionId;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(name = "merchant_name", updatable = false)
    private String merchantName;

    @Column(name = "pattern_key", nullable = false, updatable = false)
    private String patternKey;

    @Column(name = "old_category", updatable = false)
    private String oldCategory;

    @Column(name = "new_category", nullable = false, updatable = false)
    private String newCategory;

    @Column(name = "new_subcategory", updatable = false)
    private String newSubcategory;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
