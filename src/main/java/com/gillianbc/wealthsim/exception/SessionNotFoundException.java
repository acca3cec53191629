package com.gillianbc.wealthsim.exception;

import lombok.Getter;

/**
 * The session id is unknown or the session has expired. Callers recover by creating a new session.
 */
@Getter
public class SessionNotFoundException extends EngineException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Simulation session not found (expired?): " + sessionId);
        this.sessionId = sessionId;
    }
}
