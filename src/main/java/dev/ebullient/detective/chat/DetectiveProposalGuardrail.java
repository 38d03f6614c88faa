package dev.ebullient.detective.chat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.guardrail.OutputGuardrail;
import dev.langchain4j.guardrail.OutputGuardrailResult;

@ApplicationScoped
public class DetectiveProposalGuardrail implements OutputGuardrail {

    static final String FORMAT = """
            Return a valid JSON object with fields: question (string), topGuesses (array of {name, confidence}).
            The question MUST be a single yes/no question of at most 20 words.
            """.trim();

    @Inject
    ObjectMapper objectMapper;

    @Override
    public OutputGuardrailResult validate(AiMessage responseFromLLM) {
        String json = ParsedOracleReply.jsonObject(responseFromLLM.text());
        if (json == null) {
            return reprompt("No JSON object", new IllegalArgumentException("reply holds no JSON object"), FORMAT);
        }
        try {
            DetectiveProposal proposal = objectMapper.readValue(json, DetectiveProposal.class);
            if (ParsedOracleReply.of(proposal) instanceof ParsedOracleReply.Empty) {
                return reprompt("Empty proposal", new IllegalArgumentException("no question and no guesses"), FORMAT);
            }
            return OutputGuardrailResult.successWith(json, proposal);
        } catch (JsonProcessingException e) {
            return reprompt("Invalid JSON", e, FORMAT);
        }
    }
}
