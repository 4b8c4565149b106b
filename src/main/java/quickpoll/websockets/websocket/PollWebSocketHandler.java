package quickpoll.websockets.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Binds the {@code /ws} endpoint to the connection lifecycle and the command handler.
 */
@Component
public class PollWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(PollWebSocketHandler.class);

    private final ConnectionManager connectionManager;
    private final ClientCommandHandler commandHandler;

    public PollWebSocketHandler(ConnectionManager connectionManager, ClientCommandHandler commandHandler) {
        this.connectionManager = connectionManager;
        this.commandHandler = commandHandler;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connectionManager.connect(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        connectionManager.find(session.getId()).ifPresentOrElse(
                connection -> commandHandler.handle(connection, message.getPayload()),
                () -> log.debug("Dropping message for unregistered session {}", session.getId())
        );
    }

    /**
     * Binary frames are not part of the protocol. They are dropped and the
     * connection stays open.
     */
    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        log.warn("Dropping {}-byte binary frame from session {}", message.getPayloadLength(), session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.toString());
        connectionManager.disconnect(session.getId(), CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionManager.disconnect(session.getId(), status);
    }
}
