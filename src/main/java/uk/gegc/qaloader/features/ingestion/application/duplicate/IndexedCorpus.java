package uk.gegc.qaloader.features.ingestion.application.duplicate;

import uk.gegc.qaloader.features.question.domain.repository.CorpusEntry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stored questions prepared once for repeated comparison: normalized text for the exact tier,
 * trigram sets plus an inverted trigram index for the near tier.
 */
public final class IndexedCorpus {

    private final List<Entry> entries;
    private final Map<String, List<Entry>> byNormalizedText;
    private final Map<String, List<Entry>> byTrigram;

    private IndexedCorpus(List<Entry> entries) {
        this.entries = List.copyOf(entries);
        this.byNormalizedText = new HashMap<>();
        this.byTrigram = new HashMap<>();
        for (Entry entry : this.entries) {
            byNormalizedText.computeIfAbsent(entry.normalizedText(), key -> new ArrayList<>()).add(entry);
            for (String trigram : entry.trigrams()) {
                byTrigram.computeIfAbsent(trigram, key -> new ArrayList<>()).add(entry);
            }
        }
    }

    public static IndexedCorpus of(List<CorpusEntry> rows) {
        List<Entry> entries = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            CorpusEntry row = rows.get(i);
            entries.add(new Entry(
                    i,
                    row.questionId(),
                    TrigramSimilarity.normalize(row.question()),
                    TrigramSimilarity.trigrams(row.question())));
        }
        return new IndexedCorpus(entries);
    }

    public static IndexedCorpus empty() {
        return new IndexedCorpus(List.of());
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public List<Entry> exactMatches(String normalizedText) {
        if (normalizedText.isEmpty()) {
            return List.of();
        }
        return byNormalizedText.getOrDefault(normalizedText, Collections.emptyList());
    }

    /**
     * Entries sharing at least one trigram with the given set, in corpus order.
     */
    public List<Entry> candidatesSharing(Set<String> trigrams) {
        BitSet positions = new BitSet(entries.size());
        for (String trigram : trigrams) {
            for (Entry entry : byTrigram.getOrDefault(trigram, Collections.emptyList())) {
                positions.set(entry.position());
            }
        }
        List<Entry> candidates = new ArrayList<>(positions.cardinality());
        for (int i = positions.nextSetBit(0); i >= 0; i = positions.nextSetBit(i + 1)) {
            candidates.add(entries.get(i));
        }
        return candidates;
    }

    public record Entry(int position, String questionId, String normalizedText, Set<String> trigrams) {
    }
}
