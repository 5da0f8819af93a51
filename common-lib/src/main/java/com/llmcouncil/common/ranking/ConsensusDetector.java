package com.llmcouncil.common.ranking;

import com.llmcouncil.common.anonymization.LabelMap;
import com.llmcouncil.common.model.ConsensusCheck;
import com.llmcouncil.common.model.Evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checks whether the evaluators agree on a winner.
 *
 * <p>Counts, over evaluations with a non-empty ranking, whose response was placed first.
 * Consensus is reached when the leading backend's share of those first places is at least
 * {@code threshold}. A tie for the lead goes to the earlier participant.
 */
public final class ConsensusDetector {

    public static final double DEFAULT_THRESHOLD = 0.8;

    private ConsensusDetector() { /* utility class */ }

    public static ConsensusCheck check(Iterable<Evaluation> evaluations, LabelMap labelMap, double threshold) {
        Map<String, Integer> firstPlaces = new LinkedHashMap<>();
        labelMap.backendIds().forEach(id -> firstPlaces.put(id, 0));

        int total = 0;
        for (Evaluation evaluation : evaluations) {
            if (!evaluation.hasRanking()) continue;
            Optional<String> winner = labelMap.deanonymize(evaluation.parsedRanking().get(0));
            if (winner.isEmpty()) continue;
            firstPlaces.merge(winner.get(), 1, Integer::sum);
            total++;
        }
        if (total == 0) {
            return ConsensusCheck.none();
        }

        String leader = null;
        int leaderVotes = -1;
        for (Map.Entry<String, Integer> entry : firstPlaces.entrySet()) {
            if (entry.getValue() > leaderVotes) {
                leader = entry.getKey();
                leaderVotes = entry.getValue();
            }
        }
        double share = (double) leaderVotes / total;
        return new ConsensusCheck(share >= threshold, leader, share);
    }
}
