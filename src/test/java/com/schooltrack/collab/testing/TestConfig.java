package com.schooltrack.collab.testing;

import com.schooltrack.collab.config.CollabConfig;
import com.schooltrack.collab.config.DuplicateJoinPolicy;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link CollabConfig} with the production defaults, adjustable per test.
 */
public final class TestConfig implements CollabConfig {

    Duration idleTimeout = Duration.ofMinutes(30);
    Duration idleWarningLead = Duration.ofMinutes(1);
    Duration typingExpiry = Duration.ofSeconds(5);
    Duration lockExpiry;
    Duration connectTimeout = Duration.ofSeconds(30);
    Duration reconnectWindow = Duration.ofHours(1);
    DuplicateJoinPolicy duplicateJoinPolicy = DuplicateJoinPolicy.REPLACE;
    int chatHistorySize = 50;
    int chatMaxLength = 2000;
    int outboundQueueCapacity = 256;
    Duration writeTimeout = Duration.ofSeconds(10);

    public TestConfig idleWarningLead(Duration lead) {
        this.idleWarningLead = lead;
        return this;
    }

    public TestConfig lockExpiry(Duration expiry) {
        this.lockExpiry = expiry;
        return this;
    }

    public TestConfig duplicateJoinPolicy(DuplicateJoinPolicy policy) {
        this.duplicateJoinPolicy = policy;
        return this;
    }

    public TestConfig chatHistorySize(int size) {
        this.chatHistorySize = size;
        return this;
    }

    @Override
    public Duration idleTimeout() {
        return idleTimeout;
    }

    @Override
    public Duration idleWarningLead() {
        return idleWarningLead;
    }

    @Override
    public Duration typingExpiry() {
        return typingExpiry;
    }

    @Override
    public Optional<Duration> lockExpiry() {
        return Optional.ofNullable(lockExpiry);
    }

    @Override
    public Duration connectTimeout() {
        return connectTimeout;
    }

    @Override
    public Duration reconnectWindow() {
        return reconnectWindow;
    }

    @Override
    public DuplicateJoinPolicy duplicateJoinPolicy() {
        return duplicateJoinPolicy;
    }

    @Override
    public int chatHistorySize() {
        return chatHistorySize;
    }

    @Override
    public int chatMaxLength() {
        return chatMaxLength;
    }

    @Override
    public int outboundQueueCapacity() {
        return outboundQueueCapacity;
    }

    @Override
    public Duration writeTimeout() {
        return writeTimeout;
    }

    @Override
    public String sweepInterval() {
        return "1s";
    }
}
