package com.example.pictochat.handler;

import com.example.pictochat.model.PlayerConnection;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/** {@link PlayerConnection} over a (thread-safe, decorated) WebSocket session. */
public class WebSocketPlayerConnection implements PlayerConnection {

    private final WebSocketSession session;

    public WebSocketPlayerConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        try {
            session.sendMessage(new TextMessage(text));
        } catch (SessionLimitExceededException e) {
            // the decorator has closed the session already
            throw new IOException("Send limit exceeded for session " + session.getId(), e);
        }
    }

    @Override
    public String toString() {
        return "WebSocketPlayerConnection{" + session.getId() + "}";
    }
}
