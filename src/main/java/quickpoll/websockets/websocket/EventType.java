package quickpoll.websockets.websocket;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    SUBSCRIBED("subscribed"),
    UNSUBSCRIBED("unsubscribed"),
    PONG("pong"),
    VOTE_UPDATE("vote_update"),
    LIKE_UPDATE("like_update"),
    POLL_CREATED("poll_created"),
    POLL_UPDATE("poll_update"),
    POLL_DELETED("poll_deleted");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
