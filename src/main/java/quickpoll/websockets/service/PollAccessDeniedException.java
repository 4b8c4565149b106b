package quickpoll.websockets.service;

public class PollAccessDeniedException extends RuntimeException {

    public PollAccessDeniedException(String message) {
        super(message);
    }
}
