package quickpoll.websockets.dto;

import quickpoll.websockets.domain.PollOption;

import java.util.Map;

public record PollOptionResponse(
        long id,
        String text,
        int position,
        long voteCount
) {
    public static PollOptionResponse from(PollOption option, Map<Long, Long> voteCounts) {
        return new PollOptionResponse(
                option.id(),
                option.text(),
                option.position(),
                voteCounts.getOrDefault(option.id(), 0L)
        );
    }
}
