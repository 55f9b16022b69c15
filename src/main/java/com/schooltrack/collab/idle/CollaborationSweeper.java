package com.schooltrack.collab.idle;

import com.schooltrack.collab.chat.ChatRelay;
import com.schooltrack.collab.lock.LockManager;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodic housekeeping: idle disconnects, stale typing indicators and expired locks.
 */
@ApplicationScoped
public class CollaborationSweeper {

    private static final Logger LOG = Logger.getLogger(CollaborationSweeper.class);

    @Inject
    IdleSupervisor supervisor;

    @Inject
    ChatRelay chat;

    @Inject
    LockManager locks;

    @Inject
    Clock clock;

    @Scheduled(every = "${collab.sweep-interval:1s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        Instant now = clock.instant();
        int closed = supervisor.sweep(now);
        int typing = chat.sweepTyping(now);
        int expired = locks.sweepExpired(now);
        if (closed + typing + expired > 0) {
            LOG.debugf("Sweep closed %d connection(s), cleared %d typing indicator(s), expired %d lock(s)",
                closed, typing, expired);
        }
    }
}
