package quickpoll.websockets.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outbound server-to-client message. Topic-less events omit {@code poll_id}
 * and payload-less events omit {@code data}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PollEvent(
        EventType type,
        @JsonProperty("poll_id") Long pollId,
        Object data
) {
    public static PollEvent subscribed(long pollId) {
        return new PollEvent(EventType.SUBSCRIBED, pollId, null);
    }

    public static PollEvent unsubscribed(long pollId) {
        return new PollEvent(EventType.UNSUBSCRIBED, pollId, null);
    }

    public static PollEvent pong() {
        return new PollEvent(EventType.PONG, null, null);
    }

    public static PollEvent voteUpdate(long pollId, Object data) {
        return new PollEvent(EventType.VOTE_UPDATE, pollId, data);
    }

    public static PollEvent likeUpdate(long pollId, Object data) {
        return new PollEvent(EventType.LIKE_UPDATE, pollId, data);
    }

    public static PollEvent pollCreated(Object poll) {
        return new PollEvent(EventType.POLL_CREATED, null, poll);
    }

    public static PollEvent pollUpdated(long pollId, Object poll) {
        return new PollEvent(EventType.POLL_UPDATE, pollId, poll);
    }

    public static PollEvent pollDeleted(long pollId) {
        return new PollEvent(EventType.POLL_DELETED, pollId, null);
    }
}
