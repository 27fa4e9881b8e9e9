package uk.gegc.qaloader.features.question.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One stored question/answer row. The primary key is the semantic id assigned at upload time,
 * so the entity reports itself as new until it has been persisted or loaded.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "all_questions")
public class QuestionRecord implements Persistable<String> {

    public static final int TOPIC_MAX_LENGTH = 100;
    public static final int SUBTOPIC_MAX_LENGTH = 100;
    public static final int UPLOADED_ON_MAX_LENGTH = 20;
    public static final int UPLOADED_BY_MAX_LENGTH = 25;
    public static final int UPLOAD_NOTES_MAX_LENGTH = 100;

    @Id
    @Column(name = "question_id", length = 50, nullable = false, updatable = false)
    private String questionId;

    @Column(name = "topic", length = TOPIC_MAX_LENGTH, nullable = false)
    private String topic;

    @Column(name = "subtopic", length = SUBTOPIC_MAX_LENGTH, nullable = false)
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

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "uploaded_on", length = UPLOADED_ON_MAX_LENGTH)
    private String uploadedOn;

    @Column(name = "uploaded_by", length = UPLOADED_BY_MAX_LENGTH)
    private String uploadedBy;

    @Column(name = "upload_notes", length = UPLOAD_NOTES_MAX_LENGTH)
    private String uploadNotes;

    @Transient
    private boolean newRecord = true;

    @Override
    public String getId() {
        return questionId;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @PostPersist
    @PostLoad
    void markNotNew() {
        this.newRecord = false;
    }
}
