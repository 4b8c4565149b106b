package quickpoll.websockets.service;

import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import quickpoll.websockets.dto.LikeRequest;
import quickpoll.websockets.dto.LikeResponse;
import quickpoll.websockets.dto.LikeUpdate;
import quickpoll.websockets.repository.RedisRepository;
import quickpoll.websockets.websocket.PollEventPublisher;

@Service
public class LikeService {

    private static final Logger log = LoggerFactory.getLogger(LikeService.class);

    private final RedisRepository redisRepository;
    private final PollEventPublisher eventPublisher;
    private final Counter likesCounter;

    public LikeService(
            RedisRepository redisRepository,
            PollEventPublisher eventPublisher,
            @Qualifier("likesCounter") Counter likesCounter
    ) {
        this.redisRepository = redisRepository;
        this.eventPublisher = eventPublisher;
        this.likesCounter = likesCounter;
    }

    public LikeResponse toggleLike(long pollId, LikeRequest request) {
        if (!redisRepository.pollExists(pollId)) {
            log.warn("Like attempted on non-existent poll: {}", pollId);
            throw new PollNotFoundException(pollId);
        }

        boolean liked = redisRepository.toggleLike(pollId, request.userId());
        long totalLikes = redisRepository.getLikeCount(pollId);
        likesCounter.increment();
        log.debug("Like toggled: poll={}, user={}, liked={}, total={}", pollId, request.userId(), liked, totalLikes);

        eventPublisher.notifyLike(pollId, new LikeUpdate(totalLikes, liked, request.userId()));
        return new LikeResponse(liked, totalLikes);
    }
}
