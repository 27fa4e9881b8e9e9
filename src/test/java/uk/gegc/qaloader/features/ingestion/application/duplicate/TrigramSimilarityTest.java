package uk.gegc.qaloader.features.ingestion.application.duplicate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("TrigramSimilarity")
class TrigramSimilarityTest {

    @Test
    @DisplayName("normalize: NFKC, lower case, collapsed whitespace")
    void normalize_foldsCaseAndWhitespace() {
        assertThat(TrigramSimilarity.normalize("  What   is\tWACC?\n")).isEqualTo("what is wacc?");
        assertThat(TrigramSimilarity.normalize("ＷＡＣＣ")).isEqualTo("wacc");
        assertThat(TrigramSimilarity.normalize(null)).isEmpty();
    }

    @Test
    @DisplayName("trigrams: words padded like pg_trgm")
    void trigrams_padding() {
        assertThat(TrigramSimilarity.trigrams("cat")).containsExactlyInAnyOrder("  c", " ca", "cat", "at ");
    }

    @Test
    @DisplayName("similarity: identical texts score 1, disjoint texts score 0")
    void similarity_bounds() {
        assertThat(TrigramSimilarity.similarity("What is WACC?", "what is wacc")).isEqualTo(1.0);
        assertThat(TrigramSimilarity.similarity("abc", "xyz")).isZero();
        assertThat(TrigramSimilarity.similarity("", "xyz")).isZero();
    }

    @Test
    @DisplayName("similarity: Jaccard index of trigram sets")
    void similarity_partialOverlap() {
        // "cat": {"  c"," ca","cat","at "}, "cap": {"  c"," ca","cap","ap "}; 2 shared of 6
        assertThat(TrigramSimilarity.similarity("cat", "cap")).isCloseTo(2.0 / 6.0, within(1e-9));
    }

    @Test
    @DisplayName("similarity: near-identical questions score high")
    void similarity_nearDuplicate() {
        double score = TrigramSimilarity.similarity(
                "What is the weighted average cost of capital?",
                "What is the weighted average cost of capital");

        assertThat(score).isEqualTo(1.0);
        assertThat(TrigramSimilarity.similarity(
                "Explain the weighted average cost of capital",
                "Explain the weighted average costs of capital")).isGreaterThan(0.85);
    }
}
