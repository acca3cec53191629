package com.gillianbc.wealthsim.session;

import com.gillianbc.wealthsim.config.SimulationProperties;
import com.gillianbc.wealthsim.exception.SessionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions keyed by opaque id. Sessions idle for longer than the configured timeout are
 * dropped when next looked up, or by {@link #evictExpired()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionStore {

    private final Map<String, SimulationSession> sessions = new ConcurrentHashMap<>();
    private final SimulationProperties properties;
    private final Clock clock;

    void put(SimulationSession session) {
        sessions.put(session.getId(), session);
    }

    /**
     * Looks up a live session and marks it as used.
     *
     * @throws SessionNotFoundException if the id is unknown or the session has expired
     */
    public SimulationSession get(String sessionId) {
        SimulationSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        Instant now = clock.instant();
        if (session.isExpired(now, properties.sessionIdleTimeout())) {
            sessions.remove(sessionId, session);
            log.debug("Session {} expired", sessionId);
            throw new SessionNotFoundException(sessionId);
        }
        session.touch(now);
        return session;
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int size() {
        return sessions.size();
    }

    /** @return the number of sessions removed */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(s -> s.isExpired(now, properties.sessionIdleTimeout()));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} idle simulation sessions", evicted);
        }
        return evicted;
    }

    public boolean invalidate(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    /** Drops every session built from the given scenario, e.g. after the scenario was edited. */
    public int invalidateScenario(String scenarioId) {
        int before = sessions.size();
        sessions.values().removeIf(s -> scenarioId.equals(s.getScenario().getId()));
        return before - sessions.size();
    }

    Instant now() {
        return clock.instant();
    }
}
