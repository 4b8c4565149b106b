package quickpoll.websockets.dto;

import java.util.List;

/**
 * Payload of a {@code vote_update} event.
 */
public record VoteUpdate(
        long totalVotes,
        List<PollOptionResponse> options,
        long userId,
        long userVoteOptionId
) {}
