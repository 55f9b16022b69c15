package com.schooltrack.collab.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Tunables of the collaboration hub, bound from {@code collab.*} properties.
 */
@ConfigMapping(prefix = "collab")
public interface CollabConfig {

    /** Inactivity after which a joined connection is force-disconnected. */
    @WithDefault("PT30M")
    Duration idleTimeout();

    /** How long before the idle disconnect an {@code idleWarning} is sent. Zero disables the warning. */
    @WithDefault("PT1M")
    Duration idleWarningLead();

    @WithDefault("PT5S")
    Duration typingExpiry();

    /** Upper bound on lock lifetime; absent means a lock lives until released or its holder leaves. */
    Optional<Duration> lockExpiry();

    /** A connection still waiting for its join after this long is closed. */
    @WithDefault("PT30S")
    Duration connectTimeout();

    @WithDefault("PT1H")
    Duration reconnectWindow();

    @WithDefault("REPLACE")
    DuplicateJoinPolicy duplicateJoinPolicy();

    @WithDefault("50")
    int chatHistorySize();

    @WithDefault("2000")
    int chatMaxLength();

    @WithDefault("256")
    int outboundQueueCapacity();

    /** A single outbound write taking longer than this counts as failed. */
    @WithDefault("PT10S")
    Duration writeTimeout();

    /** Period of the housekeeping sweep, in scheduler syntax ({@code 1s}, {@code 500ms}). */
    @WithDefault("1s")
    String sweepInterval();
}
