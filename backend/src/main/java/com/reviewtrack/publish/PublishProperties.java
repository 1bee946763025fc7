package com.reviewtrack.publish;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * External publish collaborator and lease settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "reviewtrack.publish")
@NoArgsConstructor
@Getter
@Setter
public class PublishProperties {

    /** Base URL of the publish collaborator. */
    private String baseUrl = "http://localhost:8089";

    /** Path the group payload is POSTed to. */
    private String path = "/publish";

    /** Bound on one publish call. Expiry marks the attempt UNCERTAIN. Default 30s. */
    private long timeoutMs = 30_000L;

    /** Lease lifetime; must exceed timeoutMs so a live call never loses its lease. Default 2min. */
    private long leaseTtlMs = 120_000L;

    /** Publish calls allowed per second across all groups. Default 5. */
    private int maxRequestsPerSecond = 5;

    /** Max wait for a rate-limiter permit before the publish is rejected. Default 5s. */
    private long limiterTimeoutMs = 5_000L;

    /** How often (ms) expired leases are deleted. Default 10min. */
    private long leaseCleanupIntervalMs = 600_000L;
}
