package quickpoll.websockets.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import quickpoll.websockets.domain.Poll;
import quickpoll.websockets.domain.PollOption;

import java.time.Instant;
import java.util.*;

@Repository
public class RedisRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisRepository.class);

    private static final String POLL_KEY = "poll:";
    private static final String OPTIONS_SUFFIX = ":options";
    private static final String VOTES_KEY = "votes:";
    private static final String VOTERS_KEY = "voters:";
    private static final String LIKES_KEY = "likes:";
    private static final String POLLS_INDEX_KEY = "polls";
    private static final String POLL_SEQUENCE_KEY = "seq:poll";
    private static final String OPTION_SEQUENCE_KEY = "seq:option";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final RedisScript<String> castVoteScript;

    public RedisRepository(
            StringRedisTemplate redis,
            ObjectMapper objectMapper,
            RedisScript<String> castVoteScript
    ) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.castVoteScript = castVoteScript;
    }

    // Id sequences

    public long nextPollId() {
        return increment(POLL_SEQUENCE_KEY);
    }

    public long nextOptionId() {
        return increment(OPTION_SEQUENCE_KEY);
    }

    // Poll operations

    public void savePoll(Poll poll) {
        String key = POLL_KEY + poll.id();
        redis.opsForHash().putAll(key, toFields(poll));

        String optionsKey = key + OPTIONS_SUFFIX;
        redis.delete(optionsKey);
        for (PollOption option : poll.options()) {
            try {
                redis.opsForList().rightPush(optionsKey, objectMapper.writeValueAsString(option));
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize option {} of poll {}", option.id(), poll.id(), e);
            }
        }

        redis.opsForZSet().add(POLLS_INDEX_KEY, String.valueOf(poll.id()), poll.createdAt().toEpochMilli());
    }

    public void updatePoll(Poll poll) {
        String key = POLL_KEY + poll.id();
        redis.opsForHash().putAll(key, toFields(poll));
        if (poll.description() == null) {
            redis.opsForHash().delete(key, "description");
        }
    }

    public Optional<Poll> getPoll(long pollId) {
        String key = POLL_KEY + pollId;
        Map<Object, Object> fields = redis.opsForHash().entries(key);
        if (fields.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new Poll(
                parseLong(fields.get("id")),
                (String) fields.get("title"),
                (String) fields.get("description"),
                parseLong(fields.get("creatorId")),
                (String) fields.get("creatorUsername"),
                Instant.parse((String) fields.get("createdAt")),
                Boolean.parseBoolean((String) fields.get("active")),
                getOptions(pollId)
        ));
    }

    public boolean pollExists(long pollId) {
        return Boolean.TRUE.equals(redis.hasKey(POLL_KEY + pollId));
    }

    /**
     * All poll ids, most recently created first.
     */
    public List<Long> getPollIdsNewestFirst() {
        Set<String> ids = redis.opsForZSet().reverseRange(POLLS_INDEX_KEY, 0, -1);
        if (ids == null) {
            return List.of();
        }
        List<Long> pollIds = new ArrayList<>(ids.size());
        for (String id : ids) {
            pollIds.add(Long.parseLong(id));
        }
        return pollIds;
    }

    public void deletePoll(long pollId) {
        redis.delete(List.of(
                POLL_KEY + pollId,
                POLL_KEY + pollId + OPTIONS_SUFFIX,
                VOTES_KEY + pollId,
                VOTERS_KEY + pollId,
                LIKES_KEY + pollId
        ));
        redis.opsForZSet().remove(POLLS_INDEX_KEY, String.valueOf(pollId));
    }

    // Vote operations

    /**
     * Records the user's vote, moving it if the user had voted for another option.
     *
     * @return the option the user had voted for before, if any
     * @throws PollDeletedException if the poll was deleted before the vote was written
     */
    public Optional<Long> castVote(long pollId, long userId, long optionId) {
        String previous = redis.execute(
                castVoteScript,
                List.of(VOTERS_KEY + pollId, VOTES_KEY + pollId, POLL_KEY + pollId),
                String.valueOf(userId),
                String.valueOf(optionId)
        );
        if (previous == null) {
            throw new PollDeletedException(pollId);
        }
        return previous.isEmpty() ? Optional.empty() : Optional.of(Long.parseLong(previous));
    }

    public Map<Long, Long> getVoteCounts(long pollId) {
        Map<Object, Object> fields = redis.opsForHash().entries(VOTES_KEY + pollId);
        Map<Long, Long> counts = new HashMap<>();
        for (Map.Entry<Object, Object> entry : fields.entrySet()) {
            counts.put(parseLong(entry.getKey()), parseLong(entry.getValue()));
        }
        return counts;
    }

    public Optional<Long> getUserVote(long pollId, long userId) {
        Object optionId = redis.opsForHash().get(VOTERS_KEY + pollId, String.valueOf(userId));
        return optionId == null ? Optional.empty() : Optional.of(parseLong(optionId));
    }

    // Like operations

    /**
     * @return true if the poll is now liked by the user, false if the like was removed
     */
    public boolean toggleLike(long pollId, long userId) {
        String key = LIKES_KEY + pollId;
        String member = String.valueOf(userId);
        Long added = redis.opsForSet().add(key, member);
        if (added != null && added > 0) {
            return true;
        }
        redis.opsForSet().remove(key, member);
        return false;
    }

    public long getLikeCount(long pollId) {
        Long size = redis.opsForSet().size(LIKES_KEY + pollId);
        return size != null ? size : 0;
    }

    public boolean isLikedBy(long pollId, long userId) {
        return Boolean.TRUE.equals(
                redis.opsForSet().isMember(LIKES_KEY + pollId, String.valueOf(userId))
        );
    }

    private List<PollOption> getOptions(long pollId) {
        List<String> jsonOptions = redis.opsForList().range(POLL_KEY + pollId + OPTIONS_SUFFIX, 0, -1);
        if (jsonOptions == null) {
            return List.of();
        }

        List<PollOption> options = new ArrayList<>();
        for (String json : jsonOptions) {
            try {
                options.add(objectMapper.readValue(json, PollOption.class));
            } catch (JsonProcessingException e) {
                log.error("Failed to deserialize option of poll {}", pollId, e);
            }
        }
        return options;
    }

    private Map<String, String> toFields(Poll poll) {
        Map<String, String> fields = new HashMap<>();
        fields.put("id", String.valueOf(poll.id()));
        fields.put("title", poll.title());
        if (poll.description() != null) {
            fields.put("description", poll.description());
        }
        fields.put("creatorId", String.valueOf(poll.creatorId()));
        fields.put("creatorUsername", poll.creatorUsername());
        fields.put("createdAt", poll.createdAt().toString());
        fields.put("active", String.valueOf(poll.active()));
        return fields;
    }

    private long increment(String key) {
        Long value = redis.opsForValue().increment(key);
        if (value == null) {
            throw new IllegalStateException("Redis returned no value for sequence " + key);
        }
        return value;
    }

    private long parseLong(Object value) {
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
