package com.llmcouncil.orchestrator.prompt;

import com.llmcouncil.common.anonymization.AnonymizedResponse;
import com.llmcouncil.common.anonymization.LabelMap;
import com.llmcouncil.common.model.AggregateEntry;
import com.llmcouncil.common.model.Evaluation;
import com.llmcouncil.common.model.ModelResponse;
import com.llmcouncil.common.model.PromptMessage;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Assembles the prompt payload for each stage.
 *
 * <p>The evaluation prompt only ever contains labels and answer text. Backend ids appear in
 * the chairman prompt alone, which is the only place the council's identities are needed.
 *
 * <p>Pure static utility with no Spring dependencies.
 */
public final class CouncilPromptBuilder {

    private CouncilPromptBuilder() { /* utility class */ }

    /** Stage 1: the user's question, as-is. */
    public static List<PromptMessage> responsePrompt(String query) {
        return List.of(PromptMessage.user(query));
    }

    /** Stage 2: one shared prompt asking every evaluator to critique and rank all answers. */
    public static List<PromptMessage> evaluationPrompt(String query, List<AnonymizedResponse> responses) {
        String responsesText = responses.stream()
            .map(r -> r.label() + ":\n" + r.content())
            .collect(Collectors.joining("\n\n"));

        String example = exampleRanking(responses.size());

        String prompt = """
            You are evaluating different responses to the following question:

            Question: %s

            Here are the responses from different models (anonymized):

            %s

            Your task:
            1. First, evaluate each response individually. For each response, explain what it does well and what it does poorly.
            2. Then, at the very end of your response, provide a final ranking.

            IMPORTANT: Your final ranking MUST be formatted EXACTLY as follows:
            - Start with the line "FINAL RANKING:" (all caps, with colon)
            - Then list the responses from best to worst as a numbered list
            - Each line should be: number, period, space, then ONLY the response label (e.g., "1. Response A")
            - Do not add any other text or explanations in the ranking section

            Example of the ranking section:

            FINAL RANKING:
            %s

            Now provide your evaluation and ranking:""".formatted(query, responsesText, example);

        return List.of(PromptMessage.user(prompt));
    }

    /**
     * Stage 3: question, every usable Stage 1 answer, every evaluation and the aggregate
     * ordering. The Stage 2 section is left out when no evaluator produced a usable ranking.
     */
    public static List<PromptMessage> chairmanPrompt(String query,
                                                     List<ModelResponse> responses,
                                                     LabelMap labelMap,
                                                     List<Evaluation> evaluations,
                                                     List<AggregateEntry> aggregate,
                                                     boolean rankingDataAvailable) {
        String stage1Text = responses.stream()
            .filter(ModelResponse::isUsable)
            .map(r -> "Model: " + r.backendId()
                + labelMap.labelOf(r.backendId()).map(l -> " (" + l + ")").orElse("")
                + "\nResponse: " + r.content())
            .collect(Collectors.joining("\n\n"));

        StringBuilder prompt = new StringBuilder()
            .append("You are the Chairman of an LLM Council. Multiple AI models have provided ")
            .append("responses to a user's question, and then ranked each other's responses.\n\n")
            .append("Original Question: ").append(query).append("\n\n")
            .append("STAGE 1 - Individual Responses:\n").append(stage1Text).append("\n\n");

        if (rankingDataAvailable) {
            String stage2Text = evaluations.stream()
                .filter(e -> !e.failed())
                .map(e -> "Model: " + e.evaluatorBackendId() + "\nRanking: " + e.rawText())
                .collect(Collectors.joining("\n\n"));
            prompt.append("STAGE 2 - Peer Rankings:\n").append(stage2Text).append("\n\n")
                  .append("Aggregate ranking (lower average position is better):\n")
                  .append(aggregateText(aggregate)).append("\n\n");
        } else {
            prompt.append("No usable peer rankings were produced; rely on the individual responses.\n\n");
        }

        prompt.append("""
            Your task as Chairman is to synthesize all of this information into a single, comprehensive, accurate answer to the user's original question. Consider:
            - The individual responses and their insights
            - The peer rankings and what they reveal about response quality
            - Any patterns of agreement or disagreement

            Provide a clear, well-reasoned final answer that represents the council's collective wisdom:""");

        return List.of(PromptMessage.user(prompt.toString()));
    }

    private static String aggregateText(List<AggregateEntry> aggregate) {
        StringBuilder text = new StringBuilder();
        int place = 1;
        for (AggregateEntry entry : aggregate) {
            if (!entry.hasVotes()) continue;
            text.append(place++).append(". ").append(entry.backendId())
                .append(" (average position ")
                .append(String.format(Locale.ROOT, "%.2f", entry.averageRankPosition()))
                .append(", ").append(entry.votesCounted()).append(" votes)\n");
        }
        return text.toString().stripTrailing();
    }

    private static String exampleRanking(int count) {
        StringBuilder example = new StringBuilder();
        for (int i = 0; i < Math.max(count, 1); i++) {
            if (i > 0) example.append('\n');
            example.append(i + 1).append(". ").append(LabelMap.labelFor(i));
        }
        return example.toString();
    }
}
