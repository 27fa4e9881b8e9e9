package uk.gegc.qaloader.features.staging.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;
import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;

import java.time.Instant;
import java.util.UUID;

/**
 * A validated question waiting in a batch. It has no question id until it is imported.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "staged_questions")
public class StagedQuestion {

    public static final int REVIEW_NOTES_MAX_LENGTH = 255;
    public static final int IMPORT_ERROR_MAX_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "staged_id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "upload_batch_id", nullable = false, updatable = false)
    private UploadBatch batch;

    @Column(name = "block_index", nullable = false)
    private int blockIndex;

    @Column(name = "start_line", nullable = false)
    private int startLine;

    @Column(name = "topic", length = 100, nullable = false)
    private String topic;

    @Column(name = "subtopic", length = 100, nullable = false)
    private String subtopic;

    @Column(name = "difficulty", length = 20, nullable = false)
    private Difficulty difficulty;

    @Column(name = "type", length = 20, nullable = false)
    private QuestionType type;

    @Column(name = "question", columnDefinition = "TEXT", nullable = false)
    private String question;

    @Column(name = "answer", columnDefinition = "TEXT", nullable = false)
    private String answer;

    @Column(name = "notes_for_tutor", columnDefinition = "TEXT")
    private String notesForTutor;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(name = "status", length = 20, nullable = false)
    private StagedQuestionStatus status = StagedQuestionStatus.PENDING;

    @Column(name = "duplicate_of", length = 50)
    private String duplicateOf;

    @Column(name = "similarity_score")
    private Double similarityScore;

    @Column(name = "review_notes", length = REVIEW_NOTES_MAX_LENGTH)
    private String reviewNotes;

    @Column(name = "reviewed_by", length = 25)
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "imported_question_id", length = 50)
    private String importedQuestionId;

    @Column(name = "import_error", length = IMPORT_ERROR_MAX_LENGTH)
    private String importError;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void clearDuplicate() {
        this.duplicateOf = null;
        this.similarityScore = null;
    }
}
