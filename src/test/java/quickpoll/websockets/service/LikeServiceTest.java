package quickpoll.websockets.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import quickpoll.websockets.BaseIntegrationTest;
import quickpoll.websockets.dto.LikeRequest;
import quickpoll.websockets.dto.LikeResponse;
import quickpoll.websockets.dto.PollResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LikeService Integration Tests")
class LikeServiceTest extends BaseIntegrationTest {

    @Autowired
    private LikeService likeService;

    @Autowired
    private PollService pollService;

    @Test
    @DisplayName("Should toggle a like on and off")
    void shouldToggleLike() {
        // Given
        PollResponse poll = pollService.createPoll(pollRequest(uniqueUserId(), "Yes", "No"));
        long user = uniqueUserId();

        // When
        LikeResponse liked = likeService.toggleLike(poll.id(), new LikeRequest(user));

        // Then
        assertThat(liked.isLiked()).isTrue();
        assertThat(liked.totalLikes()).isEqualTo(1);
        assertThat(pollService.getPoll(poll.id(), user).userLiked()).isTrue();

        // When
        LikeResponse unliked = likeService.toggleLike(poll.id(), new LikeRequest(user));

        // Then
        assertThat(unliked.isLiked()).isFalse();
        assertThat(unliked.totalLikes()).isZero();
        assertThat(pollService.getPoll(poll.id(), user).userLiked()).isFalse();
    }

    @Test
    @DisplayName("Should count likes from different users")
    void shouldCountDistinctUsers() {
        // Given
        PollResponse poll = pollService.createPoll(pollRequest(uniqueUserId(), "Yes", "No"));

        // When
        likeService.toggleLike(poll.id(), new LikeRequest(uniqueUserId()));
        LikeResponse second = likeService.toggleLike(poll.id(), new LikeRequest(uniqueUserId()));

        // Then
        assertThat(second.totalLikes()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should throw when liking a poll that does not exist")
    void shouldRejectMissingPoll() {
        assertThatThrownBy(() -> likeService.toggleLike(Long.MAX_VALUE, new LikeRequest(uniqueUserId())))
                .isInstanceOf(PollNotFoundException.class);
    }
}
