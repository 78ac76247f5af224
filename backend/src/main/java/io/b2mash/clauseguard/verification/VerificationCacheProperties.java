package io.b2mash.clauseguard.verification;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for caching verification reports at the API layer.
 *
 * @param enabled whether reports are cached at all
 * @param maximumSize maximum number of cached reports
 * @param expireAfter time a cached report stays valid after it was computed
 */
@ConfigurationProperties(prefix = "verification.cache")
public record VerificationCacheProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("1000") long maximumSize,
    @DefaultValue("10m") Duration expireAfter) {}
