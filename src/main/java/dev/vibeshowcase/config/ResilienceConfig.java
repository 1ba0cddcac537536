package dev.vibeshowcase.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Database timeouts applied to every repository call made by the services.
 * Failures are never retried; they surface to the caller.
 *
 * <pre>
 * return projectRepository.findById(id)
 *         .timeout(resilience.getDatabaseTimeout());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration streamHeartbeat;

    public ResilienceConfig(
            @Value("${app.resilience.database-timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${app.notifications.heartbeat-seconds:30}") int heartbeatSeconds) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.streamHeartbeat = Duration.ofSeconds(heartbeatSeconds);
        log.info("Resilience configuration initialized: databaseTimeout={}s", databaseTimeoutSeconds);
    }
}
