package dev.ebullient.detective.api;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.resteasy.reactive.RestPath;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.detective.DetectiveEngine;
import dev.ebullient.detective.GameSession;
import dev.ebullient.detective.SessionRegistry;
import dev.ebullient.detective.model.AnswerValue;
import dev.ebullient.detective.model.SessionOutput;
import io.quarkus.logging.Log;

@ApplicationScoped
@Path("/api/games")
public class GameResource {

    @Inject
    SessionRegistry sessions;

    @Inject
    DetectiveEngine engine;

    @POST
    @Produces(MediaType.APPLICATION_JSON)
    public Response newGame() {
        GameSession session = sessions.create();
        SessionOutput output;
        synchronized (session) {
            output = engine.start(session);
        }
        return Response.status(Response.Status.CREATED).entity(output).build();
    }

    @GET
    @Path("/{gameId}")
    @Produces(MediaType.APPLICATION_JSON)
    public Response current(@RestPath String gameId) {
        GameSession session = sessions.get(gameId);
        if (session == null) {
            return notFound(gameId);
        }
        synchronized (session) {
            return Response.ok(engine.output(session)).build();
        }
    }

    @POST
    @Path("/{gameId}/answer")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response answer(@RestPath String gameId, JsonNode request) {
        GameSession session = sessions.get(gameId);
        if (session == null) {
            return notFound(gameId);
        }
        AnswerValue answer;
        try {
            answer = AnswerValue.fromValue(request == null ? null : request.path("answer").asText(null));
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
        synchronized (session) {
            try {
                return Response.ok(engine.answer(session, answer)).build();
            } catch (IllegalStateException e) {
                return conflict(e.getMessage());
            }
        }
    }

    @POST
    @Path("/{gameId}/guess")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response confirmGuess(@RestPath String gameId, JsonNode request) {
        GameSession session = sessions.get(gameId);
        if (session == null) {
            return notFound(gameId);
        }
        JsonNode correct = request == null ? null : request.get("correct");
        if (correct == null || !correct.isBoolean()) {
            return badRequest("correct (true or false) is required");
        }
        synchronized (session) {
            try {
                return Response.ok(engine.confirmGuess(session, correct.booleanValue())).build();
            } catch (IllegalStateException e) {
                return conflict(e.getMessage());
            }
        }
    }

    @POST
    @Path("/{gameId}/reset")
    @Produces(MediaType.APPLICATION_JSON)
    public Response reset(@RestPath String gameId) {
        GameSession session = sessions.get(gameId);
        if (session == null) {
            return notFound(gameId);
        }
        synchronized (session) {
            return Response.ok(engine.reset(session)).build();
        }
    }

    @DELETE
    @Path("/{gameId}")
    public Response delete(@RestPath String gameId) {
        if (!sessions.remove(gameId)) {
            return notFound(gameId);
        }
        return Response.noContent().build();
    }

    private static Response notFound(String gameId) {
        Log.debugf("Unknown game %s", gameId);
        return error(Response.Status.NOT_FOUND, "Unknown game: " + gameId);
    }

    private static Response badRequest(String message) {
        return error(Response.Status.BAD_REQUEST, message);
    }

    private static Response conflict(String message) {
        return error(Response.Status.CONFLICT, message);
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message))
                .build();
    }
}
