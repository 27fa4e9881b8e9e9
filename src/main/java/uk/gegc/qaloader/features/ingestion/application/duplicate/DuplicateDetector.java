package uk.gegc.qaloader.features.ingestion.application.duplicate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.qaloader.features.ingestion.config.IngestionProperties;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;
import uk.gegc.qaloader.features.question.domain.repository.QuestionRecordRepository;
import uk.gegc.qaloader.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Advisory duplicate detection. Nothing here blocks an upload or changes stored data.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DuplicateDetector {

    static final double MIN_THRESHOLD = 0.1;
    static final double MAX_THRESHOLD = 1.0;

    private final QuestionRecordRepository questionRecordRepository;
    private final SimilarityQuery similarityQuery;
    private final IngestionProperties properties;

    /**
     * Falls back to the configured default when {@code requested} is null.
     *
     * @throws ValidationException when the threshold lies outside [0.1, 1.0]
     */
    public double resolveThreshold(Double requested) {
        double threshold = requested != null ? requested : properties.getDuplicateThreshold();
        if (Double.isNaN(threshold) || threshold < MIN_THRESHOLD || threshold > MAX_THRESHOLD) {
            throw new ValidationException(
                    "Similarity threshold must be between " + MIN_THRESHOLD + " and " + MAX_THRESHOLD + ", got " + threshold);
        }
        return threshold;
    }

    /**
     * Loads every stored question with one projection query and indexes it.
     */
    @Transactional(readOnly = true)
    public IndexedCorpus loadCorpus() {
        IndexedCorpus corpus = IndexedCorpus.of(questionRecordRepository.findCorpus());
        log.debug("Indexed {} stored questions for duplicate detection", corpus.size());
        return corpus;
    }

    /**
     * Candidates with at least one match, in input order.
     */
    public Map<QuestionBlock, List<SimilarMatch>> findDuplicates(List<QuestionBlock> candidates,
                                                                 IndexedCorpus corpus,
                                                                 double threshold) {
        resolveThreshold(threshold);
        Map<QuestionBlock, List<SimilarMatch>> result = new LinkedHashMap<>();
        for (QuestionBlock candidate : candidates) {
            if (candidate.question() == null || candidate.question().isBlank()) {
                continue;
            }
            List<SimilarMatch> matches = similarityQuery.topMatches(candidate.question(), corpus, threshold);
            if (!matches.isEmpty()) {
                result.put(candidate, matches);
            }
        }
        return result;
    }

    /**
     * All-pairs scan of the stored corpus, grouped into connected components.
     */
    public List<DuplicateGroup> scanCorpus(IndexedCorpus corpus, double threshold) {
        resolveThreshold(threshold);
        List<IndexedCorpus.Entry> entries = corpus.entries();
        int[] parent = new int[entries.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        List<ScoredPair> pairs = new ArrayList<>();
        for (IndexedCorpus.Entry entry : entries) {
            for (IndexedCorpus.Entry twin : corpus.exactMatches(entry.normalizedText())) {
                if (twin.position() > entry.position()) {
                    union(parent, entry.position(), twin.position());
                    pairs.add(new ScoredPair(entry.position(), 1.0));
                }
            }
            for (IndexedCorpus.Entry other : corpus.candidatesSharing(entry.trigrams())) {
                if (other.position() <= entry.position() || entry.normalizedText().equals(other.normalizedText())) {
                    continue;
                }
                double score = TrigramSimilarity.similarity(entry.trigrams(), other.trigrams());
                if (score >= threshold) {
                    union(parent, entry.position(), other.position());
                    pairs.add(new ScoredPair(entry.position(), score));
                }
            }
        }

        Map<Integer, List<String>> members = new HashMap<>();
        for (IndexedCorpus.Entry entry : entries) {
            members.computeIfAbsent(find(parent, entry.position()), key -> new ArrayList<>()).add(entry.questionId());
        }
        Map<Integer, double[]> scoreTotals = new HashMap<>();
        for (ScoredPair pair : pairs) {
            double[] total = scoreTotals.computeIfAbsent(find(parent, pair.position()), key -> new double[2]);
            total[0] += pair.score();
            total[1]++;
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        members.forEach((root, ids) -> {
            if (ids.size() < 2) {
                return;
            }
            double[] total = scoreTotals.get(root);
            ids.sort(Comparator.naturalOrder());
            groups.add(new DuplicateGroup(ids, total[0] / total[1]));
        });
        groups.sort(Comparator.comparingDouble(DuplicateGroup::averageScore).reversed()
                .thenComparing(group -> group.questionIds().get(0)));

        log.info("Duplicate scan at threshold {} found {} groups across {} questions", threshold, groups.size(), entries.size());
        return groups;
    }

    private static int find(int[] parent, int node) {
        while (parent[node] != node) {
            parent[node] = parent[parent[node]];
            node = parent[node];
        }
        return node;
    }

    private static void union(int[] parent, int left, int right) {
        int leftRoot = find(parent, left);
        int rightRoot = find(parent, right);
        if (leftRoot != rightRoot) {
            parent[Math.max(leftRoot, rightRoot)] = Math.min(leftRoot, rightRoot);
        }
    }

    private record ScoredPair(int position, double score) {
    }
}
