package quickpoll.websockets.websocket;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import quickpoll.websockets.dto.LikeUpdate;
import quickpoll.websockets.dto.PollResponse;
import quickpoll.websockets.dto.VoteUpdate;

/**
 * Entry points used by the domain services once their writes are stored.
 *
 * Vote and like updates go to the poll's subscribers only; poll creation,
 * update and deletion go to every connected client. Publishing never fails
 * because of an unreachable client.
 */
@Component
public class PollEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(PollEventPublisher.class);

    private final MessageDispatcher dispatcher;
    private final MeterRegistry meterRegistry;

    public PollEventPublisher(MessageDispatcher dispatcher, MeterRegistry meterRegistry) {
        this.dispatcher = dispatcher;
        this.meterRegistry = meterRegistry;
    }

    public int notifyVote(long pollId, VoteUpdate update) {
        return publish(PollEvent.voteUpdate(pollId, update), pollId);
    }

    public int notifyLike(long pollId, LikeUpdate update) {
        return publish(PollEvent.likeUpdate(pollId, update), pollId);
    }

    public int notifyPollCreated(PollResponse poll) {
        log.info("Broadcasting new poll creation: {}", poll.id());
        return publish(PollEvent.pollCreated(poll), null);
    }

    public int notifyPollUpdated(long pollId, PollResponse poll) {
        log.info("Broadcasting poll update: {}, is_active: {}", pollId, poll.isActive());
        return publish(PollEvent.pollUpdated(pollId, poll), null);
    }

    public int notifyPollDeleted(long pollId) {
        log.info("Broadcasting poll deletion: {}", pollId);
        return publish(PollEvent.pollDeleted(pollId), null);
    }

    private int publish(PollEvent event, Long topic) {
        meterRegistry.counter("quickpoll.events.published", "type", event.type().getValue()).increment();
        return topic != null
                ? dispatcher.broadcastToTopic(topic, event)
                : dispatcher.broadcastToAll(event);
    }
}
