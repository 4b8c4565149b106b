package quickpoll.websockets.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Full poll record as seen by one user. This is also the payload of
 * {@code poll_created} and {@code poll_update} events.
 */
public record PollResponse(
        long id,
        String title,
        String description,
        long creatorId,
        String creatorUsername,
        Instant createdAt,
        @JsonProperty("is_active") boolean isActive,
        List<PollOptionResponse> options,
        long totalVotes,
        long totalLikes,
        boolean userVoted,
        boolean userLiked,
        Long userVoteOptionId
) {}
