package quickpoll.websockets.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@code like_update} event.
 */
public record LikeUpdate(
        long totalLikes,
        @JsonProperty("is_liked") boolean isLiked,
        long userId
) {}
