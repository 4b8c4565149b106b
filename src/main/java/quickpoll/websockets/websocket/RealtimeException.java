package quickpoll.websockets.websocket;

/**
 * Base class for failures raised by the live update layer.
 */
public class RealtimeException extends RuntimeException {

    public RealtimeException(String message) {
        super(message);
    }

    public RealtimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
