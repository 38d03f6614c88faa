package dev.ebullient.detective.api;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import dev.ebullient.detective.CandidateStore;
import dev.ebullient.detective.model.Category;

@Path("/api/candidates")
@ApplicationScoped
public class CandidatesResource {

    public record CandidateSummary(String name, Category category, boolean fictional) {
    }

    @Inject
    CandidateStore store;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public List<CandidateSummary> list() {
        return store.all().stream()
                .map(s -> new CandidateSummary(s.name(), s.category(), s.fictional()))
                .toList();
    }
}
