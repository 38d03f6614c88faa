package dev.ebullient.detective;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import io.quarkus.logging.Log;

/**
 * Live game sessions by id. Callers lock a session while a turn runs.
 * <p>
 * Sessions idle for longer than {@code detective.sessions.idle-timeout} are dropped, and
 * the least recently used session is dropped when {@code detective.sessions.max} is reached.
 */
@ApplicationScoped
public class SessionRegistry {

    @ConfigProperty(name = "detective.sessions.max", defaultValue = "500")
    int maxSessions = 500;

    @ConfigProperty(name = "detective.sessions.idle-timeout", defaultValue = "PT1H")
    Duration idleTimeout = Duration.ofHours(1);

    Clock clock = Clock.systemUTC();

    private final Map<String, Tracked> sessions = new ConcurrentHashMap<>();

    public GameSession create() {
        evictIdle();
        while (sessions.size() >= maxSessions) {
            if (!evictOldest()) {
                break;
            }
        }
        GameSession session = new GameSession(UUID.randomUUID().toString());
        sessions.put(session.id(), new Tracked(session, clock.instant()));
        return session;
    }

    /**
     * @return the session, or null if the id is unknown or the session has expired
     */
    public GameSession get(String id) {
        if (id == null) {
            return null;
        }
        Tracked tracked = sessions.get(id);
        if (tracked == null) {
            return null;
        }
        Instant now = clock.instant();
        if (isIdle(tracked, now)) {
            sessions.remove(id, tracked);
            Log.debugf("%s: session expired", id);
            return null;
        }
        tracked.lastSeen = now;
        return tracked.session;
    }

    public boolean remove(String id) {
        return id != null && sessions.remove(id) != null;
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Drop every session that has not been touched within the idle timeout.
     *
     * @return the number of sessions dropped
     */
    public int evictIdle() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(t -> isIdle(t, now));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            Log.debugf("Dropped %d idle sessions; %d remain", evicted, sessions.size());
        }
        return evicted;
    }

    private boolean evictOldest() {
        return sessions.values().stream()
                .min(Comparator.comparing((Tracked t) -> t.lastSeen))
                .map(oldest -> {
                    Log.infof("%s: session limit (%d) reached; dropping least recently used session",
                            oldest.session.id(), maxSessions);
                    return sessions.remove(oldest.session.id(), oldest);
                })
                .orElse(false);
    }

    private boolean isIdle(Tracked tracked, Instant now) {
        return tracked.lastSeen.plus(idleTimeout).isBefore(now);
    }

    private static class Tracked {
        final GameSession session;
        volatile Instant lastSeen;

        Tracked(GameSession session, Instant lastSeen) {
            this.session = session;
            this.lastSeen = lastSeen;
        }
    }
}
