package uk.gegc.qaloader.features.ingestion.application.id;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.qaloader.features.ingestion.config.IngestionProperties;
import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;
import uk.gegc.qaloader.shared.exception.IdGenerationException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds readable ids of the form {@code TOPIC-SUBTOPIC-D-T-SEQ}, for example {@code DCF-WACC-B-D-001}.
 * <p>
 * The existence check is optimistic. The unique key on {@code question_id} decides in the end,
 * so callers must be ready to ask for a fresh id when an insert collides.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionIdGenerator {

    static final int MAX_TOPIC_CODE_LENGTH = 10;
    static final int MAX_SUBTOPIC_CODE_LENGTH = 8;
    static final String UNKNOWN_CODE = "UNKNOWN";

    private static final Pattern ABBREVIATION = Pattern.compile("\\(([^)]+)\\)");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,9}");

    private final IngestionProperties properties;

    public String generate(String topic, String subtopic, Difficulty difficulty, QuestionType type,
                           QuestionIdLookup lookup) {
        String prefix = prefix(topic, subtopic, difficulty, type);
        int sequence = lookup.maxSequenceForPrefix(prefix) + 1;
        int maxAttempts = properties.getIdMaxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = formatId(prefix, sequence);
            if (!lookup.existsById(candidate)) {
                return candidate;
            }
            log.debug("Question id {} already taken (attempt {}/{})", candidate, attempt, maxAttempts);
            sequence++;
        }

        throw new IdGenerationException(
                "Could not find a free question id for prefix '" + prefix + "' after " + maxAttempts + " attempts");
    }

    public String prefix(String topic, String subtopic, Difficulty difficulty, QuestionType type) {
        return topicCode(topic) + "-" + subtopicCode(subtopic) + "-" + difficulty.getCode() + "-" + type.getCode();
    }

    static String formatId(String prefix, int sequence) {
        return prefix + "-" + String.format("%03d", sequence);
    }

    static String topicCode(String topic) {
        if (topic == null) {
            return UNKNOWN_CODE;
        }
        Matcher matcher = ABBREVIATION.matcher(topic);
        if (matcher.find()) {
            String abbreviation = alphanumericUpper(matcher.group(1));
            if (!abbreviation.isEmpty() && abbreviation.length() <= MAX_TOPIC_CODE_LENGTH) {
                return abbreviation;
            }
        }
        return truncateOrUnknown(alphanumericUpper(topic), MAX_TOPIC_CODE_LENGTH);
    }

    static String subtopicCode(String subtopic) {
        if (subtopic == null) {
            return UNKNOWN_CODE;
        }
        return truncateOrUnknown(alphanumericUpper(subtopic), MAX_SUBTOPIC_CODE_LENGTH);
    }

    /**
     * Numeric suffix of {@code questionId} when it has the form {@code prefix-NNN}, otherwise 0.
     */
    public static int sequenceOf(String prefix, String questionId) {
        if (questionId == null || !questionId.startsWith(prefix + "-")) {
            return 0;
        }
        String suffix = questionId.substring(prefix.length() + 1);
        if (!DIGITS.matcher(suffix).matches()) {
            return 0;
        }
        return Integer.parseInt(suffix);
    }

    private static String alphanumericUpper(String value) {
        return NON_ALPHANUMERIC.matcher(value).replaceAll("").toUpperCase(Locale.ROOT);
    }

    private static String truncateOrUnknown(String code, int maxLength) {
        if (code.isEmpty()) {
            return UNKNOWN_CODE;
        }
        return code.length() > maxLength ? code.substring(0, maxLength) : code;
    }
}
