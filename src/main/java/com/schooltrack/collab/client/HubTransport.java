package com.schooltrack.collab.client;

import java.util.concurrent.CompletionStage;

/**
 * Client side of a persistent hub connection.
 */
public interface HubTransport {

    CompletionStage<Session> open(Listener listener);

    interface Session {

        void sendText(String text);

        void close();
    }

    interface Listener {

        void onText(String text);

        void onClosed();
    }
}
