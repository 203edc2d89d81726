package com.agentmux.session;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the session registry.
 * <p>
 * Reports UP with live and retained session counts, or FULL when no further session
 * can be spawned.
 */
@Component("sessionsHealthIndicator")
public class SessionHealthIndicator implements HealthIndicator {

    private final SessionRegistry registry;

    public SessionHealthIndicator(SessionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        int live = registry.liveSessionCount();
        int capacity = registry.capacity();
        var builder = Health.up()
                .withDetail("live", live)
                .withDetail("capacity", capacity)
                .withDetail("retained", registry.sessionCount());
        return live >= capacity ? builder.status("FULL").build() : builder.build();
    }
}
