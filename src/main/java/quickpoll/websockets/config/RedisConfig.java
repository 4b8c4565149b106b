package quickpoll.websockets.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    /**
     * KEYS[1] voters hash, KEYS[2] vote counts hash, KEYS[3] poll hash,
     * ARGV[1] user id, ARGV[2] option id.
     * Returns the option the user voted for before, an empty string on a first
     * vote, or false without writing anything once the poll has been deleted.
     */
    private static final String CAST_VOTE_SCRIPT = """
            if redis.call('EXISTS', KEYS[3]) == 0 then
                return false
            end
            local previous = redis.call('HGET', KEYS[1], ARGV[1])
            if previous == ARGV[2] then
                return previous
            end
            redis.call('HSET', KEYS[1], ARGV[1], ARGV[2])
            if previous then
                redis.call('HINCRBY', KEYS[2], previous, -1)
            else
                previous = ''
            end
            redis.call('HINCRBY', KEYS[2], ARGV[2], 1)
            return previous
            """;

    @Value("${spring.data.redis.url:NOT_SET}")
    private String redisUrl;

    @PostConstruct
    public void logRedisConfig() {
        // Mask password for logging
        String maskedUrl = redisUrl.replaceAll("://[^:]+:([^@]+)@", "://***:***@");
        log.info("Redis URL configured: {}", maskedUrl);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    public RedisScript<String> castVoteScript() {
        return RedisScript.of(CAST_VOTE_SCRIPT, String.class);
    }
}
