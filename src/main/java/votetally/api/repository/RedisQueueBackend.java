package votetally.api.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import votetally.api.domain.TallyEntry;
import votetally.api.domain.TallyResult;
import votetally.api.domain.VoteRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appends votes to a Redis list. Counts are read from the hash that
 * {@link votetally.api.scheduler.VoteQueueDrainer} maintains, so the tally
 * trails the queue by at most one drain cycle.
 */
public class RedisQueueBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisQueueBackend.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String queueKey;
    private final String tallyKey;

    public RedisQueueBackend(
            StringRedisTemplate redis,
            ObjectMapper objectMapper,
            String queueKey,
            String tallyKey
    ) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.queueKey = queueKey;
        this.tallyKey = tallyKey;
    }

    @Override
    public void write(VoteRecord record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(QueuedVote.from(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize vote " + record.voterId(), e);
        }

        try {
            Long length = redis.opsForList().rightPush(queueKey, json);
            log.debug("Queued vote {} on {} (length={})", record.voterId(), queueKey, length);
        } catch (DataAccessException e) {
            throw StorageException.from("Queueing vote " + record.voterId(), e);
        }
    }

    @Override
    public TallyResult tally() {
        Map<Object, Object> fields;
        try {
            fields = redis.opsForHash().entries(tallyKey);
        } catch (DataAccessException e) {
            throw StorageException.from("Reading tally", e);
        }

        List<TallyEntry> entries = new ArrayList<>();
        for (Map.Entry<Object, Object> field : fields.entrySet()) {
            long count = parseLong(field.getValue());
            if (count > 0) {
                entries.add(new TallyEntry((String) field.getKey(), count));
            }
        }
        return new TallyResult(entries);
    }

    public String getQueueKey() {
        return queueKey;
    }

    public String getTallyKey() {
        return tallyKey;
    }

    private long parseLong(Object value) {
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric tally value {} in {}", value, tallyKey);
            return 0;
        }
    }
}
