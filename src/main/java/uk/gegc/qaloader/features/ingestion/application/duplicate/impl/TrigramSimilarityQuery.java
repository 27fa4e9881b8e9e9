package uk.gegc.qaloader.features.ingestion.application.duplicate.impl;

import org.springframework.stereotype.Component;
import uk.gegc.qaloader.features.ingestion.application.duplicate.IndexedCorpus;
import uk.gegc.qaloader.features.ingestion.application.duplicate.SimilarMatch;
import uk.gegc.qaloader.features.ingestion.application.duplicate.SimilarityQuery;
import uk.gegc.qaloader.features.ingestion.application.duplicate.TrigramSimilarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class TrigramSimilarityQuery implements SimilarityQuery {

    static final Comparator<SimilarMatch> BY_SCORE_THEN_ID = Comparator
            .comparingDouble(SimilarMatch::score).reversed()
            .thenComparing(SimilarMatch::existingId);

    @Override
    public List<SimilarMatch> topMatches(String text, IndexedCorpus corpus, double threshold) {
        String normalized = TrigramSimilarity.normalize(text);
        List<SimilarMatch> matches = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (IndexedCorpus.Entry entry : corpus.exactMatches(normalized)) {
            if (seen.add(entry.questionId())) {
                matches.add(new SimilarMatch(entry.questionId(), 1.0, true));
            }
        }

        Set<String> trigrams = TrigramSimilarity.trigrams(text);
        for (IndexedCorpus.Entry entry : corpus.candidatesSharing(trigrams)) {
            if (seen.contains(entry.questionId())) {
                continue;
            }
            double score = TrigramSimilarity.similarity(trigrams, entry.trigrams());
            if (score >= threshold) {
                seen.add(entry.questionId());
                // texts differing only in punctuation share every trigram
                matches.add(new SimilarMatch(entry.questionId(), score, score >= 1.0));
            }
        }

        matches.sort(BY_SCORE_THEN_ID);
        return matches;
    }
}
