package uk.gegc.qaloader.features.ingestion.application.scan;

import org.springframework.stereotype.Component;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static uk.gegc.qaloader.features.ingestion.application.scan.MarkdownPatterns.*;

/**
 * Splits a question document into self-contained {@link QuestionBlock}s.
 * <p>
 * A block opens at a {@code # Topic:} line whose next three non-blank lines are the subtopic,
 * difficulty and type headers, in that order. Header lines are never indented; markers may be. Anything else is skipped up to the next
 * topic line. Every block re-reads its own headers; nothing carries over from the previous one.
 */
@Component
public class MarkdownBlockScanner {

    /**
     * Lazy single-pass cursor over the blocks of {@code rawText}, in document order.
     */
    public Iterator<QuestionBlock> scan(String rawText) {
        return new BlockCursor(lines(rawText == null ? "" : rawText));
    }

    /**
     * Convenience for callers that need the whole sequence.
     */
    public List<QuestionBlock> scanAll(String rawText) {
        List<QuestionBlock> blocks = new ArrayList<>();
        scan(rawText).forEachRemaining(blocks::add);
        return blocks;
    }

    private static final class BlockCursor implements Iterator<QuestionBlock> {

        private final String[] lines;
        private int position;
        private int emitted;
        private QuestionBlock next;

        private BlockCursor(String[] lines) {
            this.lines = lines;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public QuestionBlock next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            QuestionBlock block = next;
            next = null;
            return block;
        }

        private QuestionBlock advance() {
            while (true) {
                int topicLine = findTopic(position);
                if (topicLine < 0) {
                    position = lines.length;
                    return null;
                }

                String topic = capture(TOPIC, lines[topicLine]);
                int subtopicLine = nextNonBlank(topicLine + 1);
                int difficultyLine = nextNonBlank(subtopicLine + 1);
                int typeLine = nextNonBlank(difficultyLine + 1);
                String subtopic = capture(SUBTOPIC, lineAt(subtopicLine));
                String difficulty = capture(DIFFICULTY, lineAt(difficultyLine));
                String type = capture(TYPE, lineAt(typeLine));

                if (topic == null || subtopic == null || difficulty == null || type == null) {
                    position = topicLine + 1;
                    continue;
                }

                int bodyStart = typeLine + 1;
                int bodyEnd = findTopic(bodyStart);
                if (bodyEnd < 0) {
                    bodyEnd = lines.length;
                }
                position = bodyEnd;

                return buildBlock(topicLine, bodyStart, bodyEnd, topic, subtopic, difficulty, type);
            }
        }

        private QuestionBlock buildBlock(int topicLine, int bodyStart, int bodyEnd,
                                         String topic, String subtopic, String difficulty, String type) {
            List<String> questionLines = null;
            List<String> answerLines = null;
            List<String> notesLines = null;
            List<String> current = null;

            for (int i = bodyStart; i < bodyEnd; i++) {
                String line = lines[i];
                Matcher matcher;
                if (questionLines == null && (matcher = QUESTION_MARKER.matcher(line)).matches()) {
                    questionLines = new ArrayList<>();
                    questionLines.add(matcher.group(1));
                    current = questionLines;
                } else if (answerLines == null && (matcher = ANSWER_MARKER.matcher(line)).matches()) {
                    answerLines = new ArrayList<>();
                    answerLines.add(matcher.group(1));
                    current = answerLines;
                } else if (notesLines == null && (matcher = NOTES_MARKER.matcher(line)).matches()) {
                    notesLines = new ArrayList<>();
                    notesLines.add(matcher.group(1));
                    current = notesLines;
                } else if (current != null) {
                    current.add(line);
                }
            }

            String notes = joinSection(notesLines);
            if (notes != null && notes.isEmpty()) {
                notes = null;
            }

            int lastLine = bodyEnd - 1;
            while (lastLine > topicLine && lines[lastLine].isBlank()) {
                lastLine--;
            }

            emitted++;
            return new QuestionBlock(
                    emitted,
                    topicLine + 1,
                    lastLine + 1,
                    topic,
                    subtopic,
                    difficulty,
                    type,
                    joinSection(questionLines),
                    joinSection(answerLines),
                    notes
            );
        }

        private int findTopic(int from) {
            for (int i = Math.max(from, 0); i < lines.length; i++) {
                if (TOPIC.matcher(lines[i]).matches()) {
                    return i;
                }
            }
            return -1;
        }

        private int nextNonBlank(int from) {
            if (from < 0) {
                return -1;
            }
            for (int i = from; i < lines.length; i++) {
                if (!lines[i].isBlank()) {
                    return i;
                }
            }
            return -1;
        }

        private String lineAt(int index) {
            return index >= 0 && index < lines.length ? lines[index] : null;
        }
    }

    private static String capture(Pattern pattern, String line) {
        if (line == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Joins section lines, drops trailing horizontal rules and collapses blank-line runs.
     * Returns null when the section marker was never seen.
     */
    private static String joinSection(List<String> sectionLines) {
        if (sectionLines == null) {
            return null;
        }
        int end = sectionLines.size();
        while (end > 0) {
            String line = sectionLines.get(end - 1);
            if (line.isBlank() || HORIZONTAL_RULE.matcher(line).matches()) {
                end--;
            } else {
                break;
            }
        }
        String joined = String.join("\n", sectionLines.subList(0, end));
        return BLANK_LINE_RUN.matcher(joined).replaceAll("\n\n").trim();
    }
}
