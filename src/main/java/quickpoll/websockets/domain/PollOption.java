package quickpoll.websockets.domain;

public record PollOption(
        long id,
        String text,
        int position
) {
}
