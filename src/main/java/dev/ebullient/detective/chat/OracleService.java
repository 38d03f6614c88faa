package dev.ebullient.detective.chat;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import dev.ebullient.detective.GameSession;
import dev.ebullient.detective.model.AnswerValue;
import dev.ebullient.detective.model.Guess;
import dev.ebullient.detective.model.Trait;
import dev.ebullient.detective.model.Turn;
import io.quarkus.logging.Log;

/**
 * Every language-model round-trip goes through here. Calls run under a timeout;
 * failures never reach the caller: they come back as null, an empty list or a
 * {@link ParsedOracleReply.Malformed} reply.
 */
@ApplicationScoped
public class OracleService {

    @Inject
    DetectiveAssistant detective;

    @Inject
    TraitExtractionAssistant traitExtractor;

    @Inject
    BeyondDatabaseAssistant beyondDatabase;

    @ConfigProperty(name = "detective.oracle.timeout", defaultValue = "20s")
    Duration timeout;

    @ConfigProperty(name = "detective.oracle.enabled", defaultValue = "true")
    boolean enabled;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        AtomicInteger count = new AtomicInteger();
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "detective-oracle-" + count.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * Ask the model which trait an answer confirms.
     *
     * @return the raw proposal, or null if the model failed or confirmed nothing
     */
    public TraitProposal proposeTrait(GameSession session, String question, AnswerValue answer) {
        if (!enabled) {
            return null;
        }
        try {
            TraitProposal proposal = call(() -> traitExtractor.extract(session.id(),
                    question, answer.display(), formatTraits(session.traits())));
            return proposal == null || proposal.isEmpty() ? null : proposal;
        } catch (Exception e) {
            Log.warnf(e, "%s: trait extraction failed for '%s'", session.id(), question);
            return null;
        }
    }

    /**
     * Ask the model for the next question and its current guesses.
     */
    public ParsedOracleReply proposeQuestion(GameSession session, String candidateContext) {
        if (!enabled) {
            return ParsedOracleReply.EMPTY;
        }
        try {
            DetectiveProposal proposal = call(() -> detective.propose(session.id(),
                    session.turn(),
                    formatTraits(session.traits()),
                    formatHistory(session.turns()),
                    formatList(session.rejectedNames()),
                    formatList(session.ambiguousQuestions()),
                    candidateContext));
            return ParsedOracleReply.of(proposal);
        } catch (TimeoutException e) {
            Log.warnf("%s: question proposal timed out after %s", session.id(), timeout);
            return new ParsedOracleReply.Malformed("timed out after " + timeout);
        } catch (Exception e) {
            Log.warnf(e, "%s: question proposal failed", session.id());
            return new ParsedOracleReply.Malformed(String.valueOf(e.getMessage()));
        }
    }

    /**
     * Names outside the candidate store that fit the ledger.
     */
    public List<Guess> beyondDatabase(GameSession session) {
        if (!enabled) {
            return List.of();
        }
        try {
            BeyondDatabaseGuesses response = call(() -> beyondDatabase.guess(session.id(),
                    formatTraits(session.traits()),
                    formatHistory(session.turns()),
                    formatList(session.rejectedNames())));
            if (response == null || response.guesses() == null) {
                return List.of();
            }
            return response.guesses().stream()
                    .filter(g -> g != null && g.name() != null && !g.name().isBlank())
                    .toList();
        } catch (Exception e) {
            Log.warnf(e, "%s: beyond-database guesses failed", session.id());
            return List.of();
        }
    }

    <T> T call(Callable<T> task) throws Exception {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    // --- Prompt formatting ---

    public static String formatTraits(List<Trait> traits) {
        if (traits.isEmpty()) {
            return "None yet.";
        }
        return traits.stream()
                .map(t -> "- " + t.toPromptLine())
                .collect(Collectors.joining("\n"));
    }

    public static String formatHistory(List<Turn> turns) {
        if (turns.isEmpty()) {
            return "No questions asked yet.";
        }
        return turns.stream()
                .map(t -> "- " + t.toPromptLine())
                .collect(Collectors.joining("\n"));
    }

    static String formatList(List<String> values) {
        if (values.isEmpty()) {
            return "None.";
        }
        return values.stream()
                .map(v -> "- " + v)
                .collect(Collectors.joining("\n"));
    }
}
