package com.schooltrack.collab.idle;

import com.schooltrack.collab.config.CollabConfig;
import com.schooltrack.collab.message.DisconnectReason;
import com.schooltrack.collab.message.ServerMessage;
import com.schooltrack.collab.session.ClientChannel;
import com.schooltrack.collab.session.ConnectedUser;
import com.schooltrack.collab.session.ConnectionRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches every open connection, force-disconnects the ones that go quiet and hands out
 * reconnect tickets so an idle-disconnected client can return to its room.
 * <p>
 * Reconnecting is always the client's call; the supervisor never retries on its behalf.
 */
@ApplicationScoped
public class IdleSupervisor {

    private static final Logger LOG = Logger.getLogger(IdleSupervisor.class);

    private final ConcurrentHashMap<String, Supervision> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<TicketKey, ReconnectTicket> tickets = new ConcurrentHashMap<>();

    private final ConnectionRegistry registry;
    private final CollabConfig config;
    private final Clock clock;

    record Supervision(ClientChannel channel, ConnectionState state, Instant since, Instant warnedFor) {

        Supervision to(ConnectionState next, Instant at) {
            return new Supervision(channel, next, at, null);
        }

        Supervision warned(Instant lastActivity) {
            return new Supervision(channel, state, since, lastActivity);
        }
    }

    /** Room an idle-disconnected user may rejoin without naming it. */
    public record ReconnectTicket(String userId, String documentId, Instant expiresAt) {

        TicketKey key() {
            return new TicketKey(userId, documentId);
        }
    }

    // one ticket per user and document, so several idle tabs keep their own rooms
    record TicketKey(String userId, String documentId) {}

    @Inject
    public IdleSupervisor(ConnectionRegistry registry, CollabConfig config, Clock clock) {
        this.registry = registry;
        this.config = config;
        this.clock = clock;
    }

    /** Starts supervising a freshly opened connection. */
    public void track(ClientChannel channel) {
        connections.put(channel.id(), new Supervision(channel, ConnectionState.CONNECTING, clock.instant(), null));
    }

    /**
     * A join or reconnect is in flight. Suppresses the idle timer until {@link #joined} or {@link #attemptFailed}.
     */
    public void joinAttempt(String connectionId) {
        connections.computeIfPresent(connectionId, (id, s) -> s.state() == ConnectionState.CONNECTING
            ? s
            : s.to(ConnectionState.CONNECTING, clock.instant()));
    }

    public void joined(String connectionId) {
        connections.computeIfPresent(connectionId, (id, s) -> s.to(ConnectionState.CONNECTED, clock.instant()));
    }

    /**
     * The join attempt failed. A connection that still belongs to a room goes back to being supervised
     * for idleness; one without a room stays connecting until the connect timeout.
     */
    public void attemptFailed(String connectionId) {
        if (registry.find(connectionId).isPresent()) {
            joined(connectionId);
        }
    }

    /** The connection left its room but stays open, waiting for another join. */
    public void leftRoom(String connectionId) {
        connections.computeIfPresent(connectionId, (id, s) -> s.to(ConnectionState.CONNECTING, clock.instant()));
    }

    /** Transport is gone; nothing left to supervise. */
    public void released(String connectionId) {
        connections.remove(connectionId);
    }

    public ConnectionState state(String connectionId) {
        Supervision s = connections.get(connectionId);
        return s == null ? ConnectionState.DISCONNECTED : s.state();
    }

    /**
     * Resolves the room a reconnect rejoins and consumes the matching ticket. A room named by the
     * client always wins; without one, the user's most recent live ticket decides. A ticket can be
     * claimed once.
     *
     * @return the room to rejoin, or empty if none was named and no live ticket is left
     */
    public Optional<String> claimReconnect(String userId, String requestedDocumentId) {
        Instant now = clock.instant();
        if (requestedDocumentId != null) {
            tickets.remove(new TicketKey(userId, requestedDocumentId));
            return Optional.of(requestedDocumentId);
        }
        while (true) {
            Optional<ReconnectTicket> latest = tickets.values().stream()
                .filter(t -> t.userId().equals(userId) && now.isBefore(t.expiresAt()))
                .max(Comparator.comparing(ReconnectTicket::expiresAt));
            if (latest.isEmpty()) {
                return Optional.empty();
            }
            ReconnectTicket ticket = latest.get();
            if (tickets.remove(ticket.key(), ticket)) {
                return Optional.of(ticket.documentId());
            }
        }
    }

    /**
     * One pass over all supervised connections: warns, idle-disconnects, closes stalled
     * connection attempts and drops stale reconnect tickets.
     *
     * @return number of connections closed
     */
    public int sweep(Instant now) {
        int closed = 0;
        for (Map.Entry<String, Supervision> entry : connections.entrySet()) {
            Supervision s = entry.getValue();
            switch (s.state()) {
                case CONNECTING -> {
                    if (!now.isBefore(s.since().plus(config.connectTimeout())) && closeStalled(entry.getKey(), s)) {
                        closed++;
                    }
                }
                case CONNECTED -> {
                    if (checkIdle(entry.getKey(), s, now)) {
                        closed++;
                    }
                }
                default -> {
                    // already on its way out
                }
            }
        }
        tickets.values().removeIf(t -> !now.isBefore(t.expiresAt()));
        return closed;
    }

    private boolean checkIdle(String connectionId, Supervision s, Instant now) {
        ConnectedUser user = registry.find(connectionId).orElse(null);
        if (user == null) {
            return false;
        }
        Instant disconnectAt = user.lastActivity().plus(config.idleTimeout());
        if (!now.isBefore(disconnectAt)) {
            return disconnectIdle(connectionId, s, user, now);
        }
        Duration lead = config.idleWarningLead();
        if (!lead.isZero() && !lead.isNegative()
            && !now.isBefore(disconnectAt.minus(lead))
            && !user.lastActivity().equals(s.warnedFor())
            && connections.replace(connectionId, s, s.warned(user.lastActivity()))) {
            LOG.debugf("Warning %s on %s about idle disconnect at %s", user.userId(), user.documentId(), disconnectAt);
            user.channel().send(ServerMessage.idleWarning(user.documentId(), disconnectAt));
        }
        return false;
    }

    private boolean disconnectIdle(String connectionId, Supervision s, ConnectedUser user, Instant now) {
        // the state transition is the single point deciding that this disconnect happens, and only once
        if (!connections.replace(connectionId, s, s.to(ConnectionState.IDLE_DISCONNECTED, now))) {
            return false;
        }
        LOG.infof("Disconnecting %s from %s after %s of inactivity",
            user.userId(), user.documentId(), Duration.between(user.lastActivity(), now));
        user.channel().send(ServerMessage.forceDisconnect(user.documentId(), DisconnectReason.IDLE_TIMEOUT));
        registry.leave(connectionId, DisconnectReason.IDLE_TIMEOUT);
        ReconnectTicket ticket = new ReconnectTicket(user.userId(), user.documentId(), now.plus(config.reconnectWindow()));
        tickets.put(ticket.key(), ticket);
        user.channel().close(DisconnectReason.IDLE_TIMEOUT);
        return true;
    }

    private boolean closeStalled(String connectionId, Supervision s) {
        if (!connections.remove(connectionId, s)) {
            return false;
        }
        LOG.infof("Closing connection %s: no room joined within %s", connectionId, config.connectTimeout());
        s.channel().send(ServerMessage.forceDisconnect(null, DisconnectReason.CONNECT_TIMEOUT));
        s.channel().close(DisconnectReason.CONNECT_TIMEOUT);
        return true;
    }
}
