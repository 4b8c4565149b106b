package quickpoll.websockets.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import quickpoll.websockets.websocket.Connection;
import quickpoll.websockets.websocket.ConnectionManager;
import quickpoll.websockets.websocket.SubscriptionRegistry;

/**
 * Periodically evicts connections whose transport closed without the close
 * callback reaching us. Safety net only; the normal path is the handler's
 * close and error callbacks.
 */
@Component
public class ConnectionReaper {

    private static final Logger log = LoggerFactory.getLogger(ConnectionReaper.class);

    private final SubscriptionRegistry registry;
    private final ConnectionManager connectionManager;

    public ConnectionReaper(SubscriptionRegistry registry, ConnectionManager connectionManager) {
        this.registry = registry;
        this.connectionManager = connectionManager;
    }

    @Scheduled(fixedRateString = "${app.websocket.reap-interval-ms:30000}")
    public void reapClosedConnections() {
        reap();
    }

    /**
     * @return number of connections evicted by this pass
     */
    public int reap() {
        int reaped = 0;
        for (Connection connection : registry.allConnections()) {
            if (!connection.isOpen() && connectionManager.disconnect(connection, CloseStatus.SESSION_NOT_RELIABLE)) {
                reaped++;
            }
        }
        if (reaped > 0) {
            log.debug("Reaped {} closed connection(s), {} remaining", reaped, registry.connectionCount());
        }
        return reaped;
    }
}
