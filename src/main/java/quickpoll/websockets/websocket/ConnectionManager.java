package quickpoll.websockets.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the lifecycle of client connections.
 *
 * {@link #disconnect(Connection, CloseStatus)} is the only cleanup path. Close
 * callbacks, transport errors, failed sends and the reaper all funnel through
 * it, and only the first call for a given connection has any effect.
 */
@Component
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private static final String TOMCAT_BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final SubscriptionRegistry registry;
    private final Map<String, Connection> connectionsBySession = new ConcurrentHashMap<>();
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    public ConnectionManager(
            SubscriptionRegistry registry,
            @Value("${app.websocket.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.websocket.send-buffer-size-limit:524288}") int sendBufferSizeLimit
    ) {
        this.registry = registry;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    /**
     * Registers a freshly accepted session.
     *
     * Sends on the returned connection are serialized and bounded. A backlog
     * larger than the buffer limit, or a send queued behind one that has been
     * blocked longer than the time limit, fails instead of waiting.
     *
     * @throws HandshakeException if the session is not open
     */
    public Connection connect(WebSocketSession session) {
        if (!session.isOpen()) {
            throw new HandshakeException("Session " + session.getId() + " was not accepted by the transport");
        }

        limitContainerSendTime(session);
        WebSocketSession bounded = new ConcurrentWebSocketSessionDecorator(
                session, sendTimeLimitMs, sendBufferSizeLimit);
        Connection connection = new Connection(bounded);

        registry.register(connection);
        connectionsBySession.put(connection.id(), connection);

        log.info("WebSocket connected: {} from {} (total: {})",
                connection.id(), session.getRemoteAddress(), registry.connectionCount());
        return connection;
    }

    public Optional<Connection> find(String sessionId) {
        return Optional.ofNullable(connectionsBySession.get(sessionId));
    }

    public boolean disconnect(String sessionId, CloseStatus status) {
        Connection connection = connectionsBySession.get(sessionId);
        return connection != null && disconnect(connection, status);
    }

    public boolean disconnect(Connection connection) {
        return disconnect(connection, CloseStatus.NORMAL);
    }

    /**
     * Removes the connection from the registry and closes its transport.
     *
     * @return true if this call performed the cleanup, false if the connection was already gone
     */
    public boolean disconnect(Connection connection, CloseStatus status) {
        if (!registry.removeConnection(connection)) {
            return false;
        }
        connectionsBySession.remove(connection.id(), connection);
        connection.close(status);

        log.info("WebSocket disconnected: {} ({}) (total: {})",
                connection.id(), status, registry.connectionCount());
        return true;
    }

    public int connectionCount() {
        return registry.connectionCount();
    }

    public int sendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    /**
     * Caps how long the container itself blocks on one frame, so a stalled
     * sender thread is released once the connection has been given up on.
     */
    private void limitContainerSendTime(WebSocketSession session) {
        if (!(session instanceof NativeWebSocketSession)) {
            return;
        }
        jakarta.websocket.Session nativeSession =
                ((NativeWebSocketSession) session).getNativeSession(jakarta.websocket.Session.class);
        if (nativeSession != null) {
            nativeSession.getUserProperties().put(TOMCAT_BLOCKING_SEND_TIMEOUT, (long) sendTimeLimitMs);
        }
    }
}
