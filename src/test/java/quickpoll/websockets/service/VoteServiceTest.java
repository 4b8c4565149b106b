package quickpoll.websockets.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import quickpoll.websockets.BaseIntegrationTest;
import quickpoll.websockets.dto.PollResponse;
import quickpoll.websockets.dto.PollUpdateRequest;
import quickpoll.websockets.dto.VoteRequest;
import quickpoll.websockets.dto.VoteResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VoteService Integration Tests")
class VoteServiceTest extends BaseIntegrationTest {

    @Autowired
    private VoteService voteService;

    @Autowired
    private PollService pollService;

    private long creatorId;
    private PollResponse poll;
    private long pizza;
    private long sushi;

    @BeforeEach
    void setUp() {
        creatorId = uniqueUserId();
        poll = pollService.createPoll(pollRequest(creatorId, "Pizza", "Sushi"));
        pizza = poll.options().get(0).id();
        sushi = poll.options().get(1).id();
    }

    @Nested
    @DisplayName("Nominal Flow - Cast Vote")
    class NominalFlow {

        @Test
        @DisplayName("Should record a first vote")
        void shouldRecordVote() {
            // Given
            long voter = uniqueUserId();

            // When
            VoteResponse response = voteService.castVote(poll.id(), new VoteRequest(voter, pizza));

            // Then
            assertThat(response.optionId()).isEqualTo(pizza);
            assertThat(response.previousOptionId()).isNull();
            assertThat(voteService.getVoteCounts(poll.id())).containsEntry(pizza, 1L);
            assertThat(voteService.getUserVote(poll.id(), voter)).contains(pizza);
        }

        @Test
        @DisplayName("Should move a vote when the user votes again")
        void shouldMoveVote() {
            // Given
            long voter = uniqueUserId();
            voteService.castVote(poll.id(), new VoteRequest(voter, pizza));

            // When
            VoteResponse response = voteService.castVote(poll.id(), new VoteRequest(voter, sushi));

            // Then
            assertThat(response.previousOptionId()).isEqualTo(pizza);
            Map<Long, Long> counts = voteService.getVoteCounts(poll.id());
            assertThat(counts.getOrDefault(pizza, 0L)).isZero();
            assertThat(counts).containsEntry(sushi, 1L);

            PollResponse seenByVoter = pollService.getPoll(poll.id(), voter);
            assertThat(seenByVoter.totalVotes()).isEqualTo(1);
            assertThat(seenByVoter.userVoted()).isTrue();
            assertThat(seenByVoter.userVoteOptionId()).isEqualTo(sushi);
        }

        @Test
        @DisplayName("Should not double count a repeated vote for the same option")
        void shouldIgnoreRepeatedVote() {
            // Given
            long voter = uniqueUserId();
            voteService.castVote(poll.id(), new VoteRequest(voter, pizza));

            // When
            VoteResponse response = voteService.castVote(poll.id(), new VoteRequest(voter, pizza));

            // Then
            assertThat(response.previousOptionId()).isEqualTo(pizza);
            assertThat(voteService.getVoteCounts(poll.id())).containsEntry(pizza, 1L);
        }
    }

    @Nested
    @DisplayName("Edge Case - Invalid Votes")
    class InvalidVotes {

        @Test
        @DisplayName("Should reject an option from another poll")
        void shouldRejectForeignOption() {
            // Given
            PollResponse other = pollService.createPoll(pollRequest(creatorId, "Tea", "Coffee"));
            long foreignOption = other.options().get(0).id();

            // When/Then
            assertThatThrownBy(() -> voteService.castVote(poll.id(), new VoteRequest(uniqueUserId(), foreignOption)))
                    .isInstanceOf(InvalidVoteException.class);
        }

        @Test
        @DisplayName("Should reject votes on a closed poll")
        void shouldRejectClosedPoll() {
            // Given
            pollService.updatePoll(poll.id(), new PollUpdateRequest(creatorId, null, null, false));

            // When/Then
            assertThatThrownBy(() -> voteService.castVote(poll.id(), new VoteRequest(uniqueUserId(), pizza)))
                    .isInstanceOf(InvalidVoteException.class);
            assertThat(voteService.getVoteCounts(poll.id())).isEmpty();
        }

        @Test
        @DisplayName("Should reject votes on a missing poll")
        void shouldRejectMissingPoll() {
            assertThatThrownBy(() -> voteService.castVote(Long.MAX_VALUE, new VoteRequest(uniqueUserId(), pizza)))
                    .isInstanceOf(InvalidVoteException.class);
        }
    }

    @Nested
    @DisplayName("Edge Case - Concurrent Votes")
    class ConcurrentVotes {

        @Test
        @DisplayName("Should count every distinct voter exactly once under concurrency")
        void shouldCountConcurrentVotes() throws InterruptedException {
            // Given
            int voters = 40;
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch latch = new CountDownLatch(voters);
            List<Throwable> failures = new ArrayList<>();

            // When - every voter votes twice, switching options
            for (int i = 0; i < voters; i++) {
                long voter = uniqueUserId();
                executor.submit(() -> {
                    try {
                        voteService.castVote(poll.id(), new VoteRequest(voter, pizza));
                        voteService.castVote(poll.id(), new VoteRequest(voter, sushi));
                    } catch (Throwable t) {
                        synchronized (failures) {
                            failures.add(t);
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }
            latch.await(30, TimeUnit.SECONDS);
            executor.shutdown();

            // Then
            assertThat(failures).isEmpty();
            Map<Long, Long> counts = voteService.getVoteCounts(poll.id());
            assertThat(counts.getOrDefault(pizza, 0L)).isZero();
            assertThat(counts).containsEntry(sushi, (long) voters);
        }
    }
}
