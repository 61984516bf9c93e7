package votetally.api.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import votetally.api.config.StorageProperties;
import votetally.api.repository.QueuedVote;

import java.util.List;

/**
 * Moves queued votes into the per-choice counter hash read by the queue
 * backend's tally.
 *
 * <p>Each message is peeked, parsed, then counted and removed by one Lua
 * script. The script only pops the message it was given, and it increments
 * before popping, so a cycle that fails leaves the message at the head of the
 * queue for the next one.
 */
@Component
@ConditionalOnProperty(prefix = "app.storage", name = "backend", havingValue = "queue")
public class VoteQueueDrainer {

    private static final Logger log = LoggerFactory.getLogger(VoteQueueDrainer.class);

    private static final RedisScript<Long> COUNT_HEAD = new DefaultRedisScript<>(
            "if redis.call('LINDEX', KEYS[1], 0) ~= ARGV[1] then\n" +
            "    return 0\n" +
            "end\n" +
            "redis.call('HINCRBY', KEYS[2], ARGV[2], 1)\n" +
            "redis.call('LPOP', KEYS[1])\n" +
            "return 1\n",
            Long.class);

    private static final RedisScript<Long> DEAD_LETTER_HEAD = new DefaultRedisScript<>(
            "if redis.call('LINDEX', KEYS[1], 0) ~= ARGV[1] then\n" +
            "    return 0\n" +
            "end\n" +
            "redis.call('RPUSH', KEYS[2], ARGV[1])\n" +
            "redis.call('LPOP', KEYS[1])\n" +
            "return 1\n",
            Long.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final StorageProperties.Queue queue;

    public VoteQueueDrainer(
            StringRedisTemplate redis,
            ObjectMapper objectMapper,
            StorageProperties properties
    ) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.queue = properties.queue();
    }

    @Scheduled(fixedDelayString = "${app.storage.queue.drain-interval-ms:1000}")
    public void drainScheduled() {
        try {
            drain();
        } catch (DataAccessException e) {
            log.warn("Vote queue drain aborted, will retry next cycle", e);
        }
    }

    /**
     * Drains at most one batch from the head of the queue.
     *
     * @return number of votes counted
     */
    public int drain() {
        int counted = 0;
        for (int i = 0; i < queue.drainBatchSize(); i++) {
            String raw = redis.opsForList().index(queue.name(), 0);
            if (raw == null) {
                break;
            }

            QueuedVote vote = parse(raw);
            if (vote == null) {
                redis.execute(DEAD_LETTER_HEAD, List.of(queue.name(), queue.deadLetterKey()), raw);
                continue;
            }

            Long moved = redis.execute(COUNT_HEAD, List.of(queue.name(), queue.tallyKey()), raw, vote.vote());
            if (moved != null && moved == 1L) {
                counted++;
            }
        }

        if (counted > 0) {
            log.debug("Drained {} votes from {}", counted, queue.name());
        }
        return counted;
    }

    private QueuedVote parse(String raw) {
        try {
            QueuedVote vote = objectMapper.readValue(raw, QueuedVote.class);
            if (vote.vote() == null) {
                log.error("Queued message has no vote field, moving to {}: {}", queue.deadLetterKey(), raw);
                return null;
            }
            return vote;
        } catch (JsonProcessingException e) {
            log.error("Malformed queued vote, moving to {}: {}", queue.deadLetterKey(), raw, e);
            return null;
        }
    }
}
