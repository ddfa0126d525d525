package com.kbchat.knowledge;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbchat.error.SourceUnavailableException;

/**
 * {@link KnowledgeSource} over a relational table with the columns
 * {@code id, question, answer, active, last_update}. Each call opens its own connection and
 * closes it before returning.
 */
public class JdbcKnowledgeSource implements KnowledgeSource {
    private static final Logger log = LoggerFactory.getLogger(JdbcKnowledgeSource.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final int queryTimeoutSeconds;
    private final String uptimeQuery;
    private final String listActiveSql;
    private final String maxModificationSql;
    private final String fetchByIdsPrefix;

    public JdbcKnowledgeSource(
            String jdbcUrl,
            String username,
            String password,
            String table,
            int queryTimeoutSeconds,
            String uptimeQuery) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("knowledge.jdbcUrl must be set");
        }
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid knowledge table name: " + table);
        }
        this.jdbcUrl = jdbcUrl;
        this.connectionProperties = new Properties();
        if (username != null) {
            connectionProperties.setProperty("user", username);
        }
        if (password != null) {
            connectionProperties.setProperty("password", password);
        }
        this.queryTimeoutSeconds = Math.max(0, queryTimeoutSeconds);
        this.uptimeQuery = uptimeQuery;
        this.listActiveSql = "SELECT id, question, answer FROM " + table + " WHERE active = TRUE ORDER BY id";
        this.maxModificationSql = "SELECT MAX(last_update) FROM " + table + " WHERE active = TRUE";
        this.fetchByIdsPrefix = "SELECT id, question, answer FROM " + table + " WHERE active = TRUE AND id IN (";
    }

    @Override
    public List<KnowledgeEntry> listActiveEntries() {
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(listActiveSql)) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = statement.executeQuery()) {
                return readEntries(rs);
            }
        } catch (SQLException e) {
            throw unavailable("list active entries", e);
        }
    }

    @Override
    public Optional<Instant> maxModificationOfActiveEntries() {
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(maxModificationSql)) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Timestamp timestamp = rs.getTimestamp(1);
                return timestamp == null ? Optional.empty() : Optional.of(timestamp.toInstant());
            }
        } catch (SQLException e) {
            throw unavailable("read last modification", e);
        }
    }

    @Override
    public long sourceUptimeSeconds() {
        try (Connection connection = connect();
                Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = statement.executeQuery(uptimeQuery)) {
                if (!rs.next()) {
                    throw new SourceUnavailableException("Uptime query returned no row", null);
                }
                return rs.getLong(rs.getMetaData().getColumnCount());
            }
        } catch (SQLException e) {
            throw unavailable("read uptime", e);
        }
    }

    @Override
    public List<KnowledgeEntry> fetchEntriesByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }
        List<Long> distinct = ids.stream().distinct().toList();
        String sql = fetchByIdsPrefix + String.join(",", Collections.nCopies(distinct.size(), "?")) + ")";
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            for (int i = 0; i < distinct.size(); i++) {
                statement.setLong(i + 1, distinct.get(i));
            }
            try (ResultSet rs = statement.executeQuery()) {
                return readEntries(rs);
            }
        } catch (SQLException e) {
            throw unavailable("fetch entries by id", e);
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private static List<KnowledgeEntry> readEntries(ResultSet rs) throws SQLException {
        List<KnowledgeEntry> entries = new ArrayList<>();
        while (rs.next()) {
            entries.add(new KnowledgeEntry(rs.getLong("id"), rs.getString("question"), rs.getString("answer")));
        }
        return entries;
    }

    private SourceUnavailableException unavailable(String operation, SQLException e) {
        log.debug("knowledge.query.failed operation={} sqlState={}", operation, e.getSQLState(), e);
        return new SourceUnavailableException("Knowledge source failed to " + operation + ": " + e.getMessage(), e);
    }
}
