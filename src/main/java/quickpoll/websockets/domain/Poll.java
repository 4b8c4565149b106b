package quickpoll.websockets.domain;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

public record Poll(
        long id,
        String title,
        String description,
        long creatorId,
        String creatorUsername,
        Instant createdAt,
        boolean active,
        List<PollOption> options
) {
    public Poll {
        options = options.stream()
                .sorted(Comparator.comparingInt(PollOption::position))
                .toList();
    }

    public boolean hasOption(long optionId) {
        return options.stream().anyMatch(option -> option.id() == optionId);
    }

    public boolean isCreatedBy(long userId) {
        return creatorId == userId;
    }

    public Poll withChanges(String newTitle, String newDescription, Boolean newActive) {
        return new Poll(
                id,
                newTitle != null ? newTitle : title,
                newDescription != null ? newDescription : description,
                creatorId,
                creatorUsername,
                createdAt,
                newActive != null ? newActive : active,
                options
        );
    }
}
