package quickpoll.websockets.service;

import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import quickpoll.websockets.domain.Poll;
import quickpoll.websockets.dto.VoteRequest;
import quickpoll.websockets.dto.VoteResponse;
import quickpoll.websockets.dto.VoteUpdate;
import quickpoll.websockets.repository.PollDeletedException;
import quickpoll.websockets.repository.RedisRepository;
import quickpoll.websockets.websocket.PollEventPublisher;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Service
public class VoteService {

    private static final Logger log = LoggerFactory.getLogger(VoteService.class);

    private final RedisRepository redisRepository;
    private final PollService pollService;
    private final PollEventPublisher eventPublisher;
    private final Counter votesCounter;

    public VoteService(
            RedisRepository redisRepository,
            PollService pollService,
            PollEventPublisher eventPublisher,
            @Qualifier("votesCounter") Counter votesCounter
    ) {
        this.redisRepository = redisRepository;
        this.pollService = pollService;
        this.eventPublisher = eventPublisher;
        this.votesCounter = votesCounter;
    }

    /**
     * Records a vote. A user has one vote per poll; voting again moves it.
     *
     * @throws InvalidVoteException if the poll is missing or closed, or the option is not part of it
     */
    public VoteResponse castVote(long pollId, VoteRequest request) {
        Poll poll = redisRepository.getPoll(pollId)
                .orElseThrow(() -> new InvalidVoteException("Invalid poll or option, or poll is inactive"));

        if (!poll.active()) {
            log.debug("Vote attempted on inactive poll: {}", pollId);
            throw new InvalidVoteException("Invalid poll or option, or poll is inactive");
        }
        if (!poll.hasOption(request.optionId())) {
            log.debug("Vote for option {} which is not part of poll {}", request.optionId(), pollId);
            throw new InvalidVoteException("Invalid poll or option, or poll is inactive");
        }

        Optional<Long> previous;
        try {
            previous = redisRepository.castVote(pollId, request.userId(), request.optionId());
        } catch (PollDeletedException e) {
            log.debug("Vote on poll {} lost the race with its deletion", pollId);
            throw new InvalidVoteException("Invalid poll or option, or poll is inactive");
        }
        votesCounter.increment();
        log.info("Vote recorded: poll={}, user={}, option={}, previous={}",
                pollId, request.userId(), request.optionId(), previous.orElse(null));

        Map<Long, Long> voteCounts = redisRepository.getVoteCounts(pollId);
        long totalVotes = voteCounts.values().stream().mapToLong(Long::longValue).sum();
        eventPublisher.notifyVote(pollId, new VoteUpdate(
                totalVotes,
                pollService.optionResponses(poll, voteCounts),
                request.userId(),
                request.optionId()
        ));

        return new VoteResponse(pollId, request.userId(), request.optionId(), previous.orElse(null), Instant.now());
    }

    public Map<Long, Long> getVoteCounts(long pollId) {
        return redisRepository.getVoteCounts(pollId);
    }

    public Optional<Long> getUserVote(long pollId, long userId) {
        return redisRepository.getUserVote(pollId, userId);
    }
}
