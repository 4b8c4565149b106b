package quickpoll.websockets.websocket;

/**
 * The transport did not hand over an open session, so no connection was created.
 */
public class HandshakeException extends RealtimeException {

    public HandshakeException(String message) {
        super(message);
    }
}
