package uk.gegc.qaloader.features.ingestion.application.scan;

import java.util.regex.Pattern;

/**
 * Line patterns of the question document format.
 */
public final class MarkdownPatterns {

    public static final Pattern TOPIC = Pattern.compile("^# Topic:\\s*(.+)$");
    public static final Pattern SUBTOPIC = Pattern.compile("^## Subtopic[^:]*:\\s*(.+)$");
    public static final Pattern DIFFICULTY = Pattern.compile("^### Difficulty:\\s*(.+)$");
    public static final Pattern TYPE = Pattern.compile("^#### Type:\\s*(.+)$");

    public static final Pattern QUESTION_MARKER = Pattern.compile("^\\s*\\*\\*Question:\\*\\*(.*)$");
    public static final Pattern ANSWER_MARKER = Pattern.compile("^\\s*\\*\\*Answer:\\*\\*(.*)$");
    public static final Pattern NOTES_MARKER = Pattern.compile("^\\s*\\*\\*Notes for Tutor:\\*\\*(.*)$");

    public static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+\\S.*$");
    public static final Pattern HORIZONTAL_RULE = Pattern.compile("^\\s*(-{3,}|\\*{3,}|_{3,})\\s*$");
    public static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");

    private MarkdownPatterns() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Splits text into lines, accepting any line terminator.
     */
    public static String[] lines(String text) {
        return text.split("\\R", -1);
    }
}
