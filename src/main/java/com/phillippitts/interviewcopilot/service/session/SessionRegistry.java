package com.phillippitts.interviewcopilot.service.session;

import com.phillippitts.interviewcopilot.config.properties.SessionProperties;
import com.phillippitts.interviewcopilot.exception.SessionLimitExceededException;
import com.phillippitts.interviewcopilot.exception.SessionNotFoundException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open sessions by id. Sessions share no mutable state; the registry only tracks them.
 */
@Component
public class SessionRegistry {

    private final Map<String, LiveSession> sessions = new ConcurrentHashMap<>();
    private final int maxSessions;

    public SessionRegistry(SessionProperties props) {
        this.maxSessions = props.maxSessions();
    }

    /**
     * @throws SessionLimitExceededException when the limit is reached
     */
    synchronized void register(LiveSession session) {
        if (sessions.size() >= maxSessions) {
            throw new SessionLimitExceededException(maxSessions);
        }
        sessions.put(session.id(), session);
    }

    void remove(String sessionId) {
        sessions.remove(sessionId);
    }

    public Optional<LiveSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException if no open session has this id
     */
    public LiveSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Collection<LiveSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
