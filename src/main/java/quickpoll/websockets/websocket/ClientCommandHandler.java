package quickpoll.websockets.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Interprets control frames sent by clients.
 *
 * <pre>
 * {"type": "subscribe",   "poll_id": 42}  ->  {"type": "subscribed",   "poll_id": 42}
 * {"type": "unsubscribe", "poll_id": 42}  ->  {"type": "unsubscribed", "poll_id": 42}
 * {"type": "ping"}                        ->  {"type": "pong"}
 * </pre>
 *
 * Anything else is logged and dropped without a reply. A bad frame never
 * closes the connection.
 */
@Component
public class ClientCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(ClientCommandHandler.class);

    private final SubscriptionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public ClientCommandHandler(
            SubscriptionRegistry registry,
            MessageDispatcher dispatcher,
            ObjectMapper objectMapper
    ) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    public void handle(Connection connection, String payload) {
        ClientCommand command;
        try {
            command = parse(payload);
        } catch (MalformedMessageException e) {
            log.warn("Dropping malformed message from {}: {}", connection, e.getMessage());
            return;
        }

        switch (command.type()) {
            case SUBSCRIBE -> {
                registry.subscribe(connection, command.pollId());
                log.debug("{} subscribed to poll {}", connection, command.pollId());
                dispatcher.sendDirect(connection, PollEvent.subscribed(command.pollId()));
            }
            case UNSUBSCRIBE -> {
                registry.unsubscribe(connection, command.pollId());
                log.debug("{} unsubscribed from poll {}", connection, command.pollId());
                dispatcher.sendDirect(connection, PollEvent.unsubscribed(command.pollId()));
            }
            case PING -> dispatcher.sendDirect(connection, PollEvent.pong());
        }
    }

    ClientCommand parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("expected a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MalformedMessageException("missing message type");
        }

        CommandType type;
        try {
            type = CommandType.fromValue(typeNode.asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage(), e);
        }

        if (type == CommandType.PING) {
            return new ClientCommand(type, 0);
        }
        return new ClientCommand(type, readPollId(root));
    }

    private long readPollId(JsonNode root) {
        JsonNode pollId = root.get("poll_id");
        if (pollId == null || !pollId.isIntegralNumber() || !pollId.canConvertToLong()) {
            throw new MalformedMessageException("poll_id must be an integer");
        }
        long value = pollId.longValue();
        if (value <= 0) {
            throw new MalformedMessageException("poll_id must be positive: " + value);
        }
        return value;
    }

    enum CommandType {
        SUBSCRIBE("subscribe"),
        UNSUBSCRIBE("unsubscribe"),
        PING("ping");

        private final String value;

        CommandType(String value) {
            this.value = value;
        }

        static CommandType fromValue(String value) {
            for (CommandType type : values()) {
                if (type.value.equals(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown message type: " + value);
        }
    }

    record ClientCommand(CommandType type, long pollId) {
    }
}
