package com.eyelevel.documentanalysis.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The unit of work for one uploaded document: its extraction, its analysis and the state
 * of both. A run is addressed by {@code (userId, runId)}; the surrogate {@code id} is only
 * used for storage and insertion ordering.
 */
@Entity
@Table(name = "analysis_run",
       uniqueConstraints = @UniqueConstraint(name = "uk_analysis_run_user_run", columnNames = {"user_id", "run_id"}),
       indexes = @Index(name = "idx_analysis_run_user_created", columnList = "user_id, created_at"))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status;

    /**
     * Set only while {@link RunStatus#PROCESSING_ASYNC}.
     */
    @Enumerated(EnumType.STRING)
    private AsyncStage asyncStage;

    @Enumerated(EnumType.STRING)
    private ModelVariant modelVariant;

    @Column(nullable = false, updatable = false)
    private String sourceFileReference;

    private String sourceFileName;

    @Column(columnDefinition = "TEXT")
    private String extractedText;

    private Integer extractedTextLength;

    private boolean extractedTextTruncated;

    private String extractedTextReference;

    @Enumerated(EnumType.STRING)
    private ExtractionMethod extractionMethod;

    @Column(columnDefinition = "TEXT")
    private String analysisResult;

    private boolean analysisResultTruncated;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Instant extractedAt;

    private Instant completedAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
