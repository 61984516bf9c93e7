package votetally.api.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import votetally.api.domain.TallyEntry;
import votetally.api.domain.TallyResult;
import votetally.api.domain.VoteRecord;

import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;

/**
 * Stores one row per vote and counts with a grouped query. Each insert runs as
 * its own auto-committed statement, so a failed write leaves no row behind.
 */
public class JdbcRelationalBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(JdbcRelationalBackend.class);

    private static final RowMapper<TallyEntry> TALLY_ROW_MAPPER = (rs, rowNum) -> new TallyEntry(
            rs.getString("vote"),
            rs.getLong("votes"));

    private final JdbcTemplate jdbcTemplate;
    private final String tableName;

    public JdbcRelationalBackend(JdbcTemplate jdbcTemplate, String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.tableName = tableName;
    }

    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + tableName + " (" +
                "id VARCHAR(255) NOT NULL PRIMARY KEY, " +
                "vote TEXT NOT NULL, " +
                "created_at TIMESTAMP NOT NULL)");
        log.info("Vote table {} ready", tableName);
    }

    @Override
    public void write(VoteRecord record) {
        String sql = "INSERT INTO " + tableName + " (id, vote, created_at) VALUES (?, ?, ?)";
        try {
            jdbcTemplate.update(sql, record.voterId(), record.choice(), Timestamp.from(record.createdAt()));
        } catch (DataAccessException e) {
            throw StorageException.from("Inserting vote " + record.voterId(), e);
        }
    }

    @Override
    public TallyResult tally() {
        String sql = "SELECT vote, COUNT(id) AS votes FROM " + tableName + " GROUP BY vote";
        try {
            List<TallyEntry> entries = jdbcTemplate.query(sql, TALLY_ROW_MAPPER);
            return new TallyResult(entries);
        } catch (DataAccessException e) {
            throw StorageException.from("Counting votes", e);
        }
    }
}
