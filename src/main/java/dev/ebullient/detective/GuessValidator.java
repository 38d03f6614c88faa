package dev.ebullient.detective;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import dev.ebullient.detective.lookup.EncyclopediaLookup;
import dev.ebullient.detective.model.Guess;
import dev.ebullient.detective.model.ReferenceTraits;
import dev.ebullient.detective.model.Trait;
import dev.ebullient.detective.model.TraitKey;
import io.quarkus.logging.Log;

/**
 * Screens guesses against the trait ledger using whatever is known about each name.
 * Names nobody knows are let through.
 */
@Singleton
public class GuessValidator {

    static final List<TraitKey> CHECKED_KEYS = List.of(TraitKey.GENDER, TraitKey.SPECIES, TraitKey.HAS_POWERS,
            TraitKey.ALIGNMENT, TraitKey.ORIGIN_MEDIUM, TraitKey.FICTIONAL, TraitKey.ALIVE);

    @Inject
    RuleTables rules;

    @Inject
    CandidateStore store;

    @Inject
    EncyclopediaLookup encyclopedia;

    @ConfigProperty(name = "detective.lookup.enabled", defaultValue = "true")
    boolean lookupEnabled;

    @ConfigProperty(name = "detective.lookup.threads", defaultValue = "4")
    int threads;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        AtomicInteger count = new AtomicInteger();
        executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "guess-lookup-" + count.getAndIncrement());
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

    public boolean isCompatible(String name, List<Trait> traits, GameSession session) {
        ReferenceTraits reference = referenceFor(name, session);
        if (reference.isUnknown()) {
            return true;
        }
        Trait contradiction = contradiction(reference, traits);
        if (contradiction != null) {
            Log.debugf("%s: %s contradicts %s=%s (%s says %s)", session.id(), name,
                    contradiction.key(), contradiction.value(), reference.source(),
                    reference.attribute(contradiction.key()));
            return false;
        }
        return true;
    }

    /**
     * Validate every guess concurrently and wait for all lookups.
     *
     * @return compatible guesses, in their original order
     */
    public List<Guess> screen(List<Guess> guesses, List<Trait> traits, GameSession session) {
        if (guesses.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<Boolean>> checks = new ArrayList<>();
        for (Guess g : guesses) {
            checks.add(CompletableFuture
                    .supplyAsync(() -> isCompatible(g.name(), traits, session), executor)
                    .exceptionally(e -> {
                        Log.warnf(e, "%s: validating %s failed; keeping it", session.id(), g.name());
                        return true;
                    }));
        }
        CompletableFuture.allOf(checks.toArray(CompletableFuture[]::new)).join();

        List<Guess> compatible = new ArrayList<>();
        for (int i = 0; i < guesses.size(); i++) {
            if (checks.get(i).join()) {
                compatible.add(guesses.get(i));
            }
        }
        return compatible;
    }

    /**
     * Reference table first, then the candidate store, then the per-session cache of
     * encyclopedia lookups. Misses are cached too.
     */
    ReferenceTraits referenceFor(String name, GameSession session) {
        ReferenceTraits reference = rules.referenceTraits(name);
        if (reference != null) {
            return reference;
        }
        var subject = store.byName(name);
        if (subject != null) {
            return new ReferenceTraits(subject.name(), subject.attributes(), "dataset");
        }
        if (!lookupEnabled) {
            return ReferenceTraits.UNKNOWN;
        }
        Map<String, ReferenceTraits> cache = session.lookupCache();
        String key = StringUtils.normalize(name);
        ReferenceTraits cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        ReferenceTraits found;
        try {
            found = encyclopedia.lookup(name);
        } catch (RuntimeException e) {
            Log.warnf(e, "%s: encyclopedia lookup for %s failed", session.id(), name);
            found = null;
        }
        if (found == null) {
            found = ReferenceTraits.UNKNOWN;
        }
        cache.putIfAbsent(key, found);
        return found;
    }

    /**
     * @return the first trait the reference contradicts, or null
     */
    Trait contradiction(ReferenceTraits reference, List<Trait> traits) {
        for (Trait t : traits) {
            TraitKey key = TraitKey.fromKey(t.key());
            if (key == null || !CHECKED_KEYS.contains(key)) {
                continue;
            }
            String known = reference.attribute(key.key());
            if (known == null || known.isBlank()) {
                continue;
            }
            boolean same = sameValue(key, t.baseValue(), known);
            if (t.isNegated() == same) {
                return t;
            }
        }
        return null;
    }

    private boolean sameValue(TraitKey key, String value, String known) {
        String v = value.trim().toLowerCase();
        String k = known.trim().toLowerCase();
        if (key == TraitKey.ORIGIN_MEDIUM) {
            return mediumGroup(v).equals(mediumGroup(k));
        }
        return v.equals(k);
    }

    // anime and manga count as one medium
    private String mediumGroup(String medium) {
        for (Map.Entry<String, List<String>> e : rules.originMediumAliases().entrySet()) {
            if (e.getKey().equals(medium) || e.getValue().contains(medium)) {
                return e.getKey().equals("manga") ? "anime" : e.getKey();
            }
        }
        return medium;
    }
}
