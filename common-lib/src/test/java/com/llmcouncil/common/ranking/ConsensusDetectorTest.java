package com.llmcouncil.common.ranking;

import com.llmcouncil.common.anonymization.LabelMap;
import com.llmcouncil.common.model.ConsensusCheck;
import com.llmcouncil.common.model.Evaluation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusDetectorTest {

    private static final LabelMap MAP = LabelMap.build(List.of("m1", "m2", "m3"));

    private static Evaluation ranking(String evaluator, String... labels) {
        return new Evaluation(evaluator, "FINAL RANKING: …", List.of(labels), false);
    }

    @Test
    @DisplayName("unanimous first place → consensus at share 1.0")
    void unanimous() {
        ConsensusCheck check = ConsensusDetector.check(List.of(
            ranking("m1", "Response B", "Response A"),
            ranking("m2", "Response B", "Response C"),
            ranking("m3", "Response B")), MAP, ConsensusDetector.DEFAULT_THRESHOLD);

        assertTrue(check.reached());
        assertEquals("m2", check.backendId());
        assertEquals(1.0, check.share(), 1e-9);
    }

    @Test
    @DisplayName("two of three is below the default threshold")
    void belowThreshold() {
        ConsensusCheck check = ConsensusDetector.check(List.of(
            ranking("m1", "Response A"),
            ranking("m2", "Response A"),
            ranking("m3", "Response C")), MAP, ConsensusDetector.DEFAULT_THRESHOLD);

        assertFalse(check.reached());
        assertEquals("m1", check.backendId());
        assertEquals(2.0 / 3.0, check.share(), 1e-9);
    }

    @Test
    @DisplayName("empty and failed rankings do not count toward the total")
    void emptyRankingsIgnored() {
        ConsensusCheck check = ConsensusDetector.check(List.of(
            ranking("m1", "Response C"),
            ranking("m2"),
            Evaluation.failed("m3")), MAP, 0.8);

        assertTrue(check.reached());
        assertEquals("m3", check.backendId());
    }

    @Test
    @DisplayName("tied leaders → earlier participant reported")
    void tieGoesToEarlierParticipant() {
        ConsensusCheck check = ConsensusDetector.check(List.of(
            ranking("m1", "Response C"),
            ranking("m2", "Response B")), MAP, 0.5);

        assertEquals("m2", check.backendId());
        assertEquals(0.5, check.share(), 1e-9);
        assertTrue(check.reached());
    }

    @Test
    @DisplayName("no votes → none")
    void noVotes() {
        assertEquals(ConsensusCheck.none(),
            ConsensusDetector.check(List.of(Evaluation.failed("m1")), MAP, 0.8));
    }
}
