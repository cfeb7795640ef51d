package com.asl.search.evidence;

import com.asl.search.completion.CompletionOptions;
import com.asl.search.completion.TextCompletion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the completion backend whether the collected spans answer the query. Never throws:
 * any call or parse failure yields {@link EvaluationVerdict#neutral()}.
 */
@Component
public class AnswerEvaluator {
    private static final Logger log = LoggerFactory.getLogger(AnswerEvaluator.class);
    private static final double TEMPERATURE = 0.0;

    private final ObjectMapper objectMapper;

    public AnswerEvaluator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EvaluationVerdict evaluate(String query, EvidenceBundle evidence, TextCompletion completion) {
        if (completion == null) {
            return EvaluationVerdict.neutral();
        }
        String text;
        try {
            text = completion.complete(buildPrompt(query, evidence), CompletionOptions.withTemperature(TEMPERATURE));
        } catch (RuntimeException e) {
            log.warn("answer evaluation call failed: {}", e.getMessage());
            return EvaluationVerdict.neutral();
        }
        return parse(text);
    }

    EvaluationVerdict parse(String text) {
        if (text == null || text.isBlank()) {
            return EvaluationVerdict.neutral();
        }
        try {
            JsonNode root = objectMapper.readTree(text.trim());
            if (root == null || !root.isObject()) {
                return EvaluationVerdict.neutral();
            }
            boolean answered = root.path("answered").asBoolean(false);
            double confidence = root.path("confidence").asDouble(0.0);
            if (Double.isNaN(confidence)) {
                confidence = 0.0;
            }
            List<String> missingFacts = new ArrayList<>();
            JsonNode facts = root.path("missing_facts");
            if (facts.isArray()) {
                for (JsonNode fact : facts) {
                    missingFacts.add(fact.asText());
                }
            }
            return new EvaluationVerdict(answered, confidence, missingFacts);
        } catch (JsonProcessingException e) {
            log.debug("answer evaluation unparseable: {}", e.getOriginalMessage());
            return EvaluationVerdict.neutral();
        }
    }

    private String buildPrompt(String query, EvidenceBundle evidence) {
        return "You are verifying if the question can be answered strictly from the provided spans. "
            + "If yes, answer concisely and indicate high confidence; if not, list the missing facts needed.\n\n"
            + "Question: " + query + "\n\n"
            + "Evidence (spans with sources):\n" + (evidence == null ? "" : evidence.render()) + "\n\n"
            + "Return ONLY valid JSON with keys: answered (boolean), confidence (number 0..1), "
            + "missing_facts (array of strings). Do not include any extra text.";
    }
}
