package uk.gegc.qaloader.features.staging.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * One uploaded file held for review before its questions reach {@code all_questions}.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "upload_batches")
public class UploadBatch {

    public static final int FILE_NAME_MAX_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "batch_id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "file_name", length = FILE_NAME_MAX_LENGTH, nullable = false)
    private String fileName;

    @Column(name = "uploaded_by", length = 25)
    private String uploadedBy;

    @Column(name = "upload_notes", length = 100)
    private String uploadNotes;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(name = "status", length = 20, nullable = false)
    private BatchStatus status = BatchStatus.PENDING;

    @Column(name = "total_questions", nullable = false)
    private int totalQuestions;

    @Column(name = "duplicate_threshold", nullable = false)
    private double duplicateThreshold;

    @Column(name = "reviewed_by", length = 25)
    private String reviewedBy;

    @Column(name = "review_started_at")
    private Instant reviewStartedAt;

    @Column(name = "import_started_at")
    private Instant importStartedAt;

    @Column(name = "import_completed_at")
    private Instant importCompletedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
