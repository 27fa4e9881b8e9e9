package uk.gegc.qaloader.features.ingestion.application.id;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.qaloader.BaseUnitTest;
import uk.gegc.qaloader.features.ingestion.config.IngestionProperties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static uk.gegc.qaloader.features.question.domain.model.Difficulty.BASIC;
import static uk.gegc.qaloader.features.question.domain.model.QuestionType.DEFINITION;

@DisplayName("BatchScopedIdLookup")
class BatchScopedIdLookupTest extends BaseUnitTest {

    @Mock
    private QuestionIdLookup store;

    private BatchScopedIdLookup lookup;

    @BeforeEach
    void setUp() {
        lookup = new BatchScopedIdLookup(store);
    }

    @Test
    @DisplayName("existsById: reserved ids count as taken without asking the store")
    void existsById_reserved() {
        lookup.reserve("DCF-WACC-B-D-001");

        assertThat(lookup.existsById("DCF-WACC-B-D-001")).isTrue();
    }

    @Test
    @DisplayName("maxSequenceForPrefix: takes the larger of store and batch")
    void maxSequence_combinesStoreAndBatch() {
        when(store.maxSequenceForPrefix("DCF-WACC-B-D")).thenReturn(2);
        lookup.reserve("DCF-WACC-B-D-005");
        lookup.reserve("OTHER-X-B-D-009");

        assertThat(lookup.maxSequenceForPrefix("DCF-WACC-B-D")).isEqualTo(5);
    }

    @Test
    @DisplayName("generator: identical prefixes in one batch get consecutive ids")
    void generator_sameBatch_consecutiveIds() {
        when(store.maxSequenceForPrefix("DCF-WACC-B-D")).thenReturn(0);
        when(store.existsById(anyString())).thenReturn(false);
        QuestionIdGenerator generator = new QuestionIdGenerator(new IngestionProperties());

        String first = generator.generate("DCF", "WACC", BASIC, DEFINITION, lookup);
        lookup.reserve(first);
        String second = generator.generate("DCF", "WACC", BASIC, DEFINITION, lookup);

        assertThat(first).isEqualTo("DCF-WACC-B-D-001");
        assertThat(second).isEqualTo("DCF-WACC-B-D-002");
    }
}
