package quickpoll.websockets.service;

public class PollNotFoundException extends RuntimeException {

    public PollNotFoundException(long pollId) {
        super("Poll not found: " + pollId);
    }
}
