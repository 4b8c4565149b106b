package quickpoll.websockets.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import quickpoll.websockets.domain.Poll;
import quickpoll.websockets.domain.PollOption;
import quickpoll.websockets.dto.PollCreateRequest;
import quickpoll.websockets.dto.PollListResponse;
import quickpoll.websockets.dto.PollOptionRequest;
import quickpoll.websockets.dto.PollOptionResponse;
import quickpoll.websockets.dto.PollResponse;
import quickpoll.websockets.dto.PollUpdateRequest;
import quickpoll.websockets.repository.RedisRepository;
import quickpoll.websockets.websocket.PollEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class PollService {

    private static final Logger log = LoggerFactory.getLogger(PollService.class);

    private final RedisRepository redisRepository;
    private final PollEventPublisher eventPublisher;

    public PollService(RedisRepository redisRepository, PollEventPublisher eventPublisher) {
        this.redisRepository = redisRepository;
        this.eventPublisher = eventPublisher;
    }

    public PollResponse createPoll(PollCreateRequest request) {
        requireUniqueOptions(request.options());

        long pollId = redisRepository.nextPollId();
        List<PollOption> options = new ArrayList<>();
        for (int position = 0; position < request.options().size(); position++) {
            String text = request.options().get(position).text().trim();
            options.add(new PollOption(redisRepository.nextOptionId(), text, position));
        }

        Poll poll = new Poll(
                pollId,
                request.title().trim(),
                request.description(),
                request.creatorId(),
                request.creatorUsername(),
                Instant.now(),
                true,
                options
        );
        redisRepository.savePoll(poll);
        log.info("Created poll {} by user {} with {} options", pollId, request.creatorId(), options.size());

        PollResponse response = toResponse(poll, request.creatorId());
        eventPublisher.notifyPollCreated(response);
        return response;
    }

    public Poll requirePoll(long pollId) {
        return redisRepository.getPoll(pollId).orElseThrow(() -> new PollNotFoundException(pollId));
    }

    public PollResponse getPoll(long pollId, Long userId) {
        return toResponse(requirePoll(pollId), userId);
    }

    /**
     * Lists polls newest first. With no filter at all only active polls are returned.
     */
    public PollListResponse listPolls(int page, int pageSize, Long creatorId, Boolean isActive, Long userId) {
        Boolean activeFilter = isActive == null && creatorId == null ? Boolean.TRUE : isActive;

        List<Poll> matching = new ArrayList<>();
        for (Long pollId : redisRepository.getPollIdsNewestFirst()) {
            redisRepository.getPoll(pollId)
                    .filter(poll -> creatorId == null || poll.creatorId() == creatorId)
                    .filter(poll -> activeFilter == null || poll.active() == activeFilter)
                    .ifPresent(matching::add);
        }

        int from = Math.min((page - 1) * pageSize, matching.size());
        int to = Math.min(from + pageSize, matching.size());
        List<PollResponse> polls = matching.subList(from, to).stream()
                .map(poll -> toResponse(poll, userId))
                .toList();

        return PollListResponse.of(polls, matching.size(), page, pageSize);
    }

    public PollResponse updatePoll(long pollId, PollUpdateRequest request) {
        Poll poll = requirePoll(pollId);
        if (!poll.isCreatedBy(request.userId())) {
            log.warn("User {} attempted to update poll {} owned by {}", request.userId(), pollId, poll.creatorId());
            throw new PollAccessDeniedException("Not authorized to update this poll");
        }

        Poll updated = poll.withChanges(
                request.title() != null ? request.title().trim() : null,
                request.description(),
                request.isActive()
        );
        redisRepository.updatePoll(updated);
        log.info("Updated poll {}: active={}", pollId, updated.active());

        PollResponse response = toResponse(updated, request.userId());
        eventPublisher.notifyPollUpdated(pollId, response);
        return response;
    }

    public void deletePoll(long pollId, long userId) {
        Poll poll = requirePoll(pollId);
        if (!poll.isCreatedBy(userId)) {
            log.warn("User {} attempted to delete poll {} owned by {}", userId, pollId, poll.creatorId());
            throw new PollAccessDeniedException("Not authorized to delete this poll");
        }

        // Clients drop the poll before it disappears from storage
        eventPublisher.notifyPollDeleted(pollId);
        redisRepository.deletePoll(pollId);
        log.info("Deleted poll {}", pollId);
    }

    public List<PollOptionResponse> optionResponses(Poll poll, Map<Long, Long> voteCounts) {
        return poll.options().stream()
                .map(option -> PollOptionResponse.from(option, voteCounts))
                .toList();
    }

    public PollResponse toResponse(Poll poll, Long userId) {
        Map<Long, Long> voteCounts = redisRepository.getVoteCounts(poll.id());
        long totalVotes = voteCounts.values().stream().mapToLong(Long::longValue).sum();
        long totalLikes = redisRepository.getLikeCount(poll.id());

        Long userVoteOptionId = null;
        boolean userLiked = false;
        if (userId != null) {
            userVoteOptionId = redisRepository.getUserVote(poll.id(), userId).orElse(null);
            userLiked = redisRepository.isLikedBy(poll.id(), userId);
        }

        return new PollResponse(
                poll.id(),
                poll.title(),
                poll.description(),
                poll.creatorId(),
                poll.creatorUsername(),
                poll.createdAt(),
                poll.active(),
                optionResponses(poll, voteCounts),
                totalVotes,
                totalLikes,
                userVoteOptionId != null,
                userLiked,
                userVoteOptionId
        );
    }

    private void requireUniqueOptions(List<PollOptionRequest> options) {
        Set<String> seen = new HashSet<>();
        for (PollOptionRequest option : options) {
            if (!seen.add(option.text().trim().toLowerCase(Locale.ROOT))) {
                throw new InvalidPollException("Poll options must be unique");
            }
        }
    }
}
