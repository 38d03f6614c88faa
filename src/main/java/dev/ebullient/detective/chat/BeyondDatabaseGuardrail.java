package dev.ebullient.detective.chat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.guardrail.OutputGuardrail;
import dev.langchain4j.guardrail.OutputGuardrailResult;

@ApplicationScoped
public class BeyondDatabaseGuardrail implements OutputGuardrail {

    static final String FORMAT = "Return a valid JSON object with field: guesses (array of {name, confidence}).";

    @Inject
    ObjectMapper objectMapper;

    @Override
    public OutputGuardrailResult validate(AiMessage responseFromLLM) {
        String json = ParsedOracleReply.jsonObject(responseFromLLM.text());
        if (json == null) {
            return reprompt("No JSON object", new IllegalArgumentException("reply holds no JSON object"), FORMAT);
        }
        try {
            BeyondDatabaseGuesses response = objectMapper.readValue(json, BeyondDatabaseGuesses.class);
            if (response.guesses() == null || response.guesses().isEmpty()) {
                return reprompt("Missing guesses", new IllegalArgumentException("guesses is empty"),
                        FORMAT + " The guesses array MUST NOT be empty.");
            }
            return OutputGuardrailResult.successWith(json, response);
        } catch (JsonProcessingException e) {
            return reprompt("Invalid JSON", e, FORMAT);
        }
    }
}
