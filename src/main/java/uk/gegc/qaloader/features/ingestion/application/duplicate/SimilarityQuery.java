package uk.gegc.qaloader.features.ingestion.application.duplicate;

import java.util.List;

/**
 * Scores one text against an indexed corpus.
 */
public interface SimilarityQuery {

    /**
     * Exact matches (score 1.0) plus near matches scoring at least {@code threshold},
     * ordered by score descending then id.
     */
    List<SimilarMatch> topMatches(String text, IndexedCorpus corpus, double threshold);
}
