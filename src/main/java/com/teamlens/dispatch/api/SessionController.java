package com.teamlens.dispatch.api;

import com.teamlens.core.persistence.SessionDetail;
import com.teamlens.core.persistence.SessionStore;
import com.teamlens.core.persistence.SessionStoreException;
import com.teamlens.core.persistence.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to recorded sessions.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionStore sessionStore;

    public SessionController(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    /**
     * GET /api/v1/sessions: history index, newest first.
     */
    @GetMapping
    public List<SessionSummary> listSessions() {
        return sessionStore.listSessions();
    }

    /**
     * GET /api/v1/sessions/{id}: config, members, messages and visible tasks of one session.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getSession(@PathVariable long id) {
        return sessionStore.findSession(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Session not found: " + id)));
    }

    @ExceptionHandler(SessionStoreException.class)
    public ResponseEntity<Map<String, String>> storeFailure(SessionStoreException e) {
        log.warn("Session query failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Session history is unavailable"));
    }
}
