package com.phillippitts.convocapture.service.health;

import com.phillippitts.convocapture.domain.SessionStats;
import com.phillippitts.convocapture.service.session.SessionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for conversation sessions.
 *
 * <ul>
 *   <li>UP: every registered session is still capturing (or none are registered)</li>
 *   <li>DEGRADED: at least one registered session has stopped capturing, e.g. its
 *       transcription stream dropped or start-up failed</li>
 * </ul>
 */
@Component
public class SessionHealthIndicator implements HealthIndicator {

    private final SessionManager sessionManager;

    public SessionHealthIndicator(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public Health health() {
        List<SessionStats> sessions = sessionManager.list();
        long running = sessions.stream().filter(SessionStats::running).count();

        Health.Builder builder = running == sessions.size() ? Health.up() : Health.status("DEGRADED");
        return builder
                .withDetail("registered", sessions.size())
                .withDetail("running", running)
                .build();
    }
}
