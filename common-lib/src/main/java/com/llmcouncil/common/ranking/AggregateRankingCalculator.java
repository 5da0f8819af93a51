package com.llmcouncil.common.ranking;

import com.llmcouncil.common.anonymization.LabelMap;
import com.llmcouncil.common.model.AggregateEntry;
import com.llmcouncil.common.model.Evaluation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combines per-evaluator rankings into one consensus ordering.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>For every ranking, record each backend's 1-based position.</li>
 *   <li>A backend missing from a ranking contributes no sample to its average; absence is
 *       not a worst-place penalty.</li>
 *   <li>Average the samples per backend.</li>
 *   <li>Order by ascending average; ties go to the backend with more first-place votes,
 *       then to the earlier participant.</li>
 *   <li>Backends with zero votes are placed last, in participant order.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe. Does not modify its inputs.
 */
public final class AggregateRankingCalculator {

    private AggregateRankingCalculator() { /* utility class */ }

    /**
     * Aggregates anonymized evaluations, resolving labels through {@code labelMap}.
     * Participant order is the label assignment order.
     */
    public static List<AggregateEntry> aggregate(List<Evaluation> evaluations, LabelMap labelMap) {
        List<List<String>> rankings = new ArrayList<>(evaluations.size());
        for (Evaluation evaluation : evaluations) {
            rankings.add(evaluation.parsedRanking().stream()
                .map(labelMap::deanonymize)
                .flatMap(Optional::stream)
                .toList());
        }
        return aggregateRankings(rankings, labelMap.backendIds());
    }

    /**
     * Aggregates rankings that are already expressed as backend ids.
     *
     * @param rankings       one list per evaluator, best first; may be empty or partial
     * @param participantIds every backend eligible for a position, in participant order
     * @return one entry per participant, best first
     */
    public static List<AggregateEntry> aggregateRankings(List<List<String>> rankings,
                                                         List<String> participantIds) {
        Map<String, Integer> order = new HashMap<>();
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (int i = 0; i < participantIds.size(); i++) {
            order.put(participantIds.get(i), i);
            tallies.put(participantIds.get(i), new Tally());
        }

        for (List<String> ranking : rankings) {
            if (ranking == null) continue;
            int position = 0;
            for (String backendId : ranking) {
                position++;
                Tally tally = tallies.get(backendId);
                if (tally == null) continue;
                tally.positionSum += position;
                tally.votes++;
                if (position == 1) tally.firstPlaces++;
            }
        }

        List<AggregateEntry> entries = new ArrayList<>(tallies.size());
        tallies.forEach((backendId, tally) -> entries.add(new AggregateEntry(
            backendId,
            tally.votes > 0 ? (double) tally.positionSum / tally.votes : null,
            tally.votes,
            tally.firstPlaces)));

        entries.sort(Comparator
            .comparing((AggregateEntry e) -> !e.hasVotes())
            .thenComparingDouble(e -> e.hasVotes() ? e.averageRankPosition() : 0.0)
            .thenComparing(Comparator.comparingInt(AggregateEntry::firstPlaceVotes).reversed())
            .thenComparingInt(e -> order.get(e.backendId())));
        return List.copyOf(entries);
    }

    /** True when at least one entry received a vote. */
    public static boolean hasRankingData(List<AggregateEntry> entries) {
        return entries.stream().anyMatch(AggregateEntry::hasVotes);
    }

    private static final class Tally {
        long positionSum;
        int votes;
        int firstPlaces;
    }
}
