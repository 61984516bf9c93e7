package votetally.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import votetally.api.repository.JdbcRelationalBackend;
import votetally.api.repository.RedisQueueBackend;
import votetally.api.repository.StorageBackend;

/**
 * Picks the {@link StorageBackend} once at startup from {@code app.storage.backend}.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    public StorageConfig(StorageProperties properties) {
        log.info("Storage backend selected: {}", properties.backend());
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.storage", name = "backend", havingValue = "queue")
    public RedisQueueBackend queueStorageBackend(
            StringRedisTemplate redis,
            ObjectMapper objectMapper,
            StorageProperties properties
    ) {
        StorageProperties.Queue queue = properties.queue();
        log.info("Using Redis queue backend: queue={}, tally={}", queue.name(), queue.tallyKey());
        return new RedisQueueBackend(redis, objectMapper, queue.name(), queue.tallyKey());
    }

    @Bean(initMethod = "initializeSchema")
    @ConditionalOnProperty(prefix = "app.storage", name = "backend", havingValue = "relational", matchIfMissing = true)
    public JdbcRelationalBackend relationalStorageBackend(
            JdbcTemplate jdbcTemplate,
            StorageProperties properties
    ) {
        String table = properties.relational().table();
        log.info("Using relational backend: table={}", table);
        return new JdbcRelationalBackend(jdbcTemplate, table);
    }
}
