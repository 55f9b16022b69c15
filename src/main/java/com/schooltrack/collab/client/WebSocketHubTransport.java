package com.schooltrack.collab.client;

import io.quarkus.websockets.next.BasicWebSocketConnector;
import io.quarkus.websockets.next.WebSocketClientConnection;
import org.jboss.logging.Logger;

import java.net.URI;
import java.util.concurrent.CompletionStage;

/**
 * {@link HubTransport} over a WebSockets Next client connection, authenticated with a bearer token.
 */
public class WebSocketHubTransport implements HubTransport {

    private static final Logger LOG = Logger.getLogger(WebSocketHubTransport.class);

    static final String PATH = "/ws/collab";

    private final BasicWebSocketConnector connector;
    private final URI baseUri;
    private final String bearerToken;

    public WebSocketHubTransport(BasicWebSocketConnector connector, URI baseUri, String bearerToken) {
        this.connector = connector;
        this.baseUri = baseUri;
        this.bearerToken = bearerToken;
    }

    @Override
    public CompletionStage<Session> open(Listener listener) {
        return connector
            .baseUri(baseUri)
            .path(PATH)
            .addHeader("Authorization", "Bearer " + bearerToken)
            .onTextMessage((connection, text) -> listener.onText(text))
            .onClose((connection, reason) -> listener.onClosed())
            .connect()
            .map(connection -> (Session) new ClientSession(connection))
            .subscribeAsCompletionStage();
    }

    private record ClientSession(WebSocketClientConnection connection) implements Session {

        @Override
        public void sendText(String text) {
            connection.sendText(text).subscribe().with(
                ignored -> { },
                failure -> LOG.debugf("Send on %s failed: %s", connection.id(), failure.getMessage()));
        }

        @Override
        public void close() {
            connection.close().subscribe().with(
                ignored -> { },
                failure -> LOG.debugf("Close of %s failed: %s", connection.id(), failure.getMessage()));
        }
    }
}
