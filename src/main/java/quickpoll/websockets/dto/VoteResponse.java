package quickpoll.websockets.dto;

import java.time.Instant;

public record VoteResponse(
        long pollId,
        long userId,
        long optionId,
        Long previousOptionId,
        Instant createdAt
) {}
