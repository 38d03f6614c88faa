package dev.ebullient.detective.lookup;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import jakarta.ws.rs.ProcessingException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.detective.CandidateStore;
import dev.ebullient.detective.RuleTables;
import dev.ebullient.detective.model.ReferenceTraits;

class WikipediaLookupTest {

    static final CandidateStore STORE = new CandidateStore(new RuleTables(), List.of());

    final ObjectMapper mapper = new ObjectMapper();
    WikipediaLookup lookup;
    int requests;

    @BeforeEach
    void setUp() {
        lookup = new WikipediaLookup();
        lookup.store = STORE;
        lookup.client = title -> {
            requests++;
            throw new ProcessingException("connection refused");
        };
    }

    @Test
    void fromSummary_fictionalCharacter() throws JsonProcessingException {
        ReferenceTraits traits = lookup.fromSummary("Paddington", page("""
                {"type": "standard", "title": "Paddington Bear",
                 "description": "Fictional character",
                 "extract": "Paddington Bear is a fictional bear from Peru. He wears a blue duffel coat."}
                """));

        assertEquals("Paddington Bear", traits.name());
        assertEquals("wikipedia", traits.source());
        assertEquals("true", traits.attribute("fictional"));
        assertEquals("male", traits.attribute("gender"));
        assertEquals("animal", traits.attribute("species"));
        assertNull(traits.attribute("has_powers"));
    }

    @Test
    void fromSummary_realPerson() throws JsonProcessingException {
        ReferenceTraits traits = lookup.fromSummary("Marie Curie", page("""
                {"type": "standard", "title": "Marie Curie",
                 "description": "Polish-French physicist and chemist (1867–1934)",
                 "extract": "Marie Curie was a physicist. She was the first woman to win a Nobel Prize."}
                """));

        assertEquals("false", traits.attribute("fictional"));
        assertEquals("female", traits.attribute("gender"));
        assertEquals("human", traits.attribute("species"));
        assertEquals("false", traits.attribute("alive"));
    }

    @Test
    void fromSummary_disambiguationPage_isUnknown() throws JsonProcessingException {
        ReferenceTraits traits = lookup.fromSummary("Mercury", page("""
                {"type": "disambiguation", "title": "Mercury", "extract": "Mercury may refer to:"}
                """));
        assertTrue(traits.isUnknown());
        assertTrue(lookup.fromSummary("Mercury", null).isUnknown());
    }

    @Test
    void lookup_failedRequest_isUnknown() {
        assertTrue(lookup.lookup("Paddington Bear").isUnknown());
        assertEquals(1, requests);
    }

    @Test
    void lookup_invalidName_skipsTheRequest() {
        assertTrue(lookup.lookup("42").isUnknown());
        assertEquals(0, requests);
    }

    @Test
    void title_usesUnderscores() {
        assertEquals("Peter_Parker", WikipediaLookup.title(" Peter Parker "));
    }

    JsonNode page(String json) throws JsonProcessingException {
        return mapper.readTree(json);
    }
}
