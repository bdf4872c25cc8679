package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.exception.SessionBusyException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Keeps requests for the same session from overlapping. A second request is refused, not queued.
 * A session is only tracked while a request for it is running.
 */
@Component
public class SessionLockRegistry {

    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        if (!active.add(sessionId)) {
            throw new SessionBusyException(sessionId);
        }
        try {
            return action.get();
        } finally {
            active.remove(sessionId);
        }
    }

    boolean isHeld(String sessionId) {
        return active.contains(sessionId);
    }
}
