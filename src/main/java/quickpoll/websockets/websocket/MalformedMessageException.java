package quickpoll.websockets.websocket;

/**
 * An inbound client frame does not match any known command shape.
 */
public class MalformedMessageException extends RealtimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
