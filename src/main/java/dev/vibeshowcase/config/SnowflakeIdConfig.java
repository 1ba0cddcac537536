package dev.vibeshowcase.config;

import dev.vibeshowcase.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Id generator wiring. The node id comes from {@code app.snowflake.node-id}
 * (env {@code SNOWFLAKE_NODE_ID}); without it a node id is derived from the hostname.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = resolveNodeId();
        log.info("Initialized Snowflake ID generator with node ID: {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long resolveNodeId() {
        if (configuredNodeId != null) {
            return configuredNodeId;
        }
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            return Math.abs(hostname.hashCode() % (SnowflakeId.MAX_NODE_ID + 1));
        } catch (UnknownHostException e) {
            log.warn("Failed to resolve hostname, using node ID 0: {}", e.getMessage());
            return 0;
        }
    }
}
