package com.phillippitts.interviewcopilot.presentation.controller;

import com.phillippitts.interviewcopilot.protocol.Payloads;
import com.phillippitts.interviewcopilot.service.session.LiveSession;
import com.phillippitts.interviewcopilot.service.session.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of open sessions. The answer history is served newest first.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SessionRegistry registry;

    SessionController(SessionRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    ResponseEntity<List<SessionSummary>> list() {
        return ResponseEntity.ok(registry.all().stream().map(SessionSummary::of).toList());
    }

    @GetMapping("/{sessionId}/answers")
    ResponseEntity<List<Payloads.Answer>> answers(@PathVariable String sessionId) {
        LiveSession session = registry.require(sessionId);
        List<Payloads.Answer> answers = session.answers().stream().map(Payloads.Answer::of).toList();
        LOG.debug("Serving answer history: session={}, answers={}", sessionId, answers.size());
        return ResponseEntity.ok(answers);
    }

    record SessionSummary(String sessionId, String userId, String openedAt, int answers) {
        static SessionSummary of(LiveSession session) {
            return new SessionSummary(session.id(), session.userId(), session.openedAt().toString(),
                    session.answers().size());
        }
    }
}
