package quickpoll.websockets.service;

public class InvalidPollException extends RuntimeException {

    public InvalidPollException(String message) {
        super(message);
    }
}
