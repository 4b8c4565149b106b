package quickpoll.websockets.repository;

/**
 * A write raced with the deletion of its poll and was not applied.
 */
public class PollDeletedException extends RuntimeException {

    public PollDeletedException(long pollId) {
        super("Poll " + pollId + " was deleted");
    }
}
