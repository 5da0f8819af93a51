package com.llmcouncil.orchestrator.prompt;

import com.llmcouncil.common.anonymization.AnonymizedResponse;
import com.llmcouncil.common.anonymization.LabelMap;
import com.llmcouncil.common.model.AggregateEntry;
import com.llmcouncil.common.model.Evaluation;
import com.llmcouncil.common.model.ModelResponse;
import com.llmcouncil.common.model.PromptMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CouncilPromptBuilderTest {

    private static final String QUERY = "Why is the sky blue?";

    @Test
    @DisplayName("stage 1 prompt is the bare user question")
    void responsePrompt() {
        assertEquals(List.of(PromptMessage.user(QUERY)), CouncilPromptBuilder.responsePrompt(QUERY));
    }

    @Test
    @DisplayName("evaluation prompt lists labelled answers and the ranking format")
    void evaluationPrompt() {
        List<PromptMessage> prompt = CouncilPromptBuilder.evaluationPrompt(QUERY, List.of(
            new AnonymizedResponse("Response A", "Rayleigh scattering."),
            new AnonymizedResponse("Response B", "Because of the ocean.")));

        assertEquals(1, prompt.size());
        String text = prompt.get(0).content();
        assertTrue(text.contains("Question: " + QUERY));
        assertTrue(text.contains("Response A:\nRayleigh scattering."));
        assertTrue(text.contains("Response B:\nBecause of the ocean."));
        assertTrue(text.contains("FINAL RANKING:\n1. Response A\n2. Response B"));
        assertTrue(text.indexOf("Response A:") < text.indexOf("Response B:"));
    }

    @Test
    @DisplayName("chairman prompt includes identities, peer rankings and the aggregate")
    void chairmanPromptWithRankings() {
        LabelMap map = LabelMap.build(List.of("m1", "m2"));
        List<ModelResponse> responses = List.of(
            ModelResponse.success("m1", "Rayleigh scattering.", null),
            ModelResponse.success("m2", "Because of the ocean.", null),
            ModelResponse.failure("m3", "HTTP 500"));
        List<Evaluation> evaluations = List.of(
            new Evaluation("m1", "A is right.\nFINAL RANKING:\n1. Response A\n2. Response B",
                           List.of("Response A", "Response B"), false),
            Evaluation.failed("m2"));
        List<AggregateEntry> aggregate = List.of(
            new AggregateEntry("m1", 1.0, 1, 1),
            new AggregateEntry("m2", 2.0, 1, 0));

        String text = CouncilPromptBuilder.chairmanPrompt(QUERY, responses, map, evaluations, aggregate, true)
            .get(0).content();

        assertTrue(text.startsWith("You are the Chairman of an LLM Council"));
        assertTrue(text.contains("Model: m1 (Response A)\nResponse: Rayleigh scattering."));
        assertFalse(text.contains("m3"));
        assertTrue(text.contains("STAGE 2 - Peer Rankings:\nModel: m1\nRanking: A is right."));
        assertTrue(text.contains("1. m1 (average position 1.00, 1 votes)"));
        assertTrue(text.contains("2. m2 (average position 2.00, 1 votes)"));
    }

    @Test
    @DisplayName("chairman prompt without ranking data leaves Stage 2 out")
    void chairmanPromptWithoutRankings() {
        LabelMap map = LabelMap.build(List.of("m1"));
        String text = CouncilPromptBuilder.chairmanPrompt(QUERY,
                List.of(ModelResponse.success("m1", "Rayleigh scattering.", null)), map,
                List.of(new Evaluation("m1", "I refuse to rank.", List.of(), false)),
                List.of(new AggregateEntry("m1", null, 0, 0)), false)
            .get(0).content();

        assertFalse(text.contains("STAGE 2"));
        assertTrue(text.contains("No usable peer rankings were produced"));
    }
}
