package uk.gegc.qaloader.features.ingestion.application.validation;

import org.springframework.stereotype.Component;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

import static uk.gegc.qaloader.features.ingestion.application.scan.MarkdownPatterns.*;

/**
 * Document-level checks over the raw text and the blocks the scanner produced.
 * All problems are collected; nothing short-circuits.
 */
@Component
public class StructuralValidator {

    static final String NO_BLOCKS_MESSAGE = "Document contains 0 valid question blocks";
    private static final String DOCUMENT_LINE = "Line 1: ";

    public List<String> checkStructure(String rawText, List<QuestionBlock> blocks) {
        String[] lines = lines(rawText == null ? "" : rawText);
        List<String> errors = new ArrayList<>();

        if (Arrays.stream(lines).noneMatch(line -> TOPIC.matcher(line).matches())) {
            errors.add(DOCUMENT_LINE + "Missing topic header. Expected format: '# Topic: Your Topic Name'");
        }
        validateHeadingLevels(lines, errors);
        validateRequiredMarkers(lines, errors);

        if (blocks.isEmpty()) {
            errors.add(DOCUMENT_LINE + NO_BLOCKS_MESSAGE);
        }
        return errors;
    }

    /**
     * Topic lines that did not open a block. These are warnings: the remaining blocks are still usable.
     */
    public List<String> findSkippedTopics(String rawText, List<QuestionBlock> blocks) {
        String[] lines = lines(rawText == null ? "" : rawText);
        Set<Integer> blockStarts = blocks.stream()
                .map(QuestionBlock::startLine)
                .collect(Collectors.toSet());

        List<String> warnings = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = TOPIC.matcher(lines[i]);
            if (matcher.matches() && !blockStarts.contains(i + 1)) {
                warnings.add(String.format(
                        "Line %d: Topic '%s' is not followed by Subtopic, Difficulty and Type headers in that order; block skipped",
                        i + 1, matcher.group(1).trim()));
            }
        }
        return warnings;
    }

    private void validateHeadingLevels(String[] lines, List<String> errors) {
        int previousLevel = 0;
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = HEADING.matcher(lines[i]);
            if (!matcher.matches()) {
                continue;
            }
            int level = matcher.group(1).length();
            if (previousLevel == 0 && level != 1) {
                errors.add(String.format("Line %d: First heading must be level 1 but is level %d", i + 1, level));
            } else if (previousLevel > 0 && level > previousLevel + 1) {
                errors.add(String.format("Line %d: Heading level jumps from %d to %d", i + 1, previousLevel, level));
            }
            previousLevel = level;
        }
    }

    private void validateRequiredMarkers(String[] lines, List<String> errors) {
        boolean subtopic = false;
        boolean difficulty = false;
        boolean type = false;
        for (String line : lines) {
            subtopic |= SUBTOPIC.matcher(line).matches();
            difficulty |= DIFFICULTY.matcher(line).matches();
            type |= TYPE.matcher(line).matches();
        }

        if (!subtopic) {
            errors.add(DOCUMENT_LINE + "No subtopic sections found. Expected format: '## Subtopic: Your Subtopic Name'");
        }
        if (!difficulty) {
            errors.add(DOCUMENT_LINE + "No difficulty headers found. Expected format: '### Difficulty: Basic'");
        }
        if (!type) {
            errors.add(DOCUMENT_LINE + "No type headers found. Expected format: '#### Type: Definition'");
        }
    }
}
