package dev.ebullient.detective.lookup;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import org.eclipse.microprofile.rest.client.inject.RestClient;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.detective.CandidateStore;
import dev.ebullient.detective.StringUtils;
import dev.ebullient.detective.model.ReferenceTraits;
import dev.ebullient.detective.model.TraitKey;
import io.quarkus.logging.Log;

/**
 * Reference traits from Wikipedia page summaries.
 */
@ApplicationScoped
public class WikipediaLookup implements EncyclopediaLookup {

    static final List<String> FICTION_MARKERS = List.of("fictional", "character in", "character from",
            "comic book character", "video game character", "protagonist of", "superhero appearing");

    @Inject
    @RestClient
    WikipediaClient client;

    @Inject
    CandidateStore store;

    @Override
    public ReferenceTraits lookup(String name) {
        if (!CandidateStore.isValidName(name)) {
            return ReferenceTraits.UNKNOWN;
        }
        try {
            return fromSummary(name, client.summary(title(name)));
        } catch (WebApplicationException e) {
            int status = e.getResponse() == null ? 0 : e.getResponse().getStatus();
            if (status == 404) {
                Log.debugf("No Wikipedia page for %s", name);
            } else {
                Log.warnf("Wikipedia lookup for %s failed with status %d", name, status);
            }
        } catch (ProcessingException e) {
            Log.warnf(e, "Wikipedia lookup for %s failed", name);
        }
        return ReferenceTraits.UNKNOWN;
    }

    ReferenceTraits fromSummary(String name, JsonNode page) {
        if (page == null || "disambiguation".equals(page.path("type").asText())) {
            return ReferenceTraits.UNKNOWN;
        }
        String text = (page.path("description").asText("") + ". " + page.path("extract").asText("")).trim();
        if (text.length() < 3) {
            return ReferenceTraits.UNKNOWN;
        }
        boolean fictional = StringUtils.containsAnyTerm(text, FICTION_MARKERS);

        Map<String, String> attributes = store.inferAttributes(text, fictional);
        if (fictional) {
            // a short summary that never mentions powers or species says nothing about them
            attributes.remove(TraitKey.HAS_POWERS.key(), "false");
            attributes.remove(TraitKey.SPECIES.key(), "human");
        }
        attributes.put(TraitKey.FICTIONAL.key(), String.valueOf(fictional));
        return new ReferenceTraits(page.path("title").asText(name), attributes, "wikipedia");
    }

    static String title(String name) {
        return name.trim().replace(' ', '_');
    }
}
