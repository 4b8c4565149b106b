package quickpoll.websockets.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;

/**
 * Handle on one client's live WebSocket session.
 *
 * Equality is reference identity: two handles wrapping the same session are
 * different connections. The wrapped session is expected to serialize its own
 * sends (see {@link ConnectionManager#connect}).
 */
public final class Connection {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    private final WebSocketSession session;
    private final Instant connectedAt;

    Connection(WebSocketSession session) {
        this.session = session;
        this.connectedAt = Instant.now();
    }

    public String id() {
        return session.getId();
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + id() + " is closed");
        }
        session.sendMessage(new TextMessage(payload));
    }

    void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Failed to close session {} cleanly", id(), e);
        }
    }

    @Override
    public String toString() {
        return "Connection[" + id() + "]";
    }
}
