package quickpoll.websockets.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LikeResponse(
        @JsonProperty("is_liked") boolean isLiked,
        long totalLikes
) {}
