package io.agentmind.memory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Keyword similarity index backed by a SQLite FTS5 table with BM25 ranking.
 *
 * <p>Schema: {@code memory_index(content, record_id UNINDEXED, memory_type UNINDEXED,
 * importance UNINDEXED)}. Scores are normalised to {@code 1 / (1 + |bm25|)}; queries that
 * FTS5 cannot parse fall back to a LIKE scan with a flat score of 0.5.</p>
 */
public class Fts5SimilarityIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(Fts5SimilarityIndex.class);
    private static final double FALLBACK_SCORE = 0.5;

    private final String dbPath;
    private Connection connection;

    public Fts5SimilarityIndex(String dbPath) {
        this.dbPath = dbPath;
    }

    @PostConstruct
    public synchronized void init() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
                stmt.execute("""
                    CREATE VIRTUAL TABLE IF NOT EXISTS memory_index USING fts5(
                        content,
                        record_id UNINDEXED,
                        memory_type UNINDEXED,
                        importance UNINDEXED
                    )
                    """);
            }
            log.info("FTS5 similarity index initialized at: {}", dbPath);
        } catch (SQLException e) {
            // Records are still stored without an index; searches will come back empty.
            log.error("Failed to initialize FTS5 index at {}", dbPath, e);
            closeQuietly();
        }
    }

    @Override
    public String name() {
        return "fts5";
    }

    @Override
    public synchronized boolean isAvailable() {
        try {
            return connection != null && !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public synchronized void index(long recordId, String content, MemoryType type, double importance) {
        requireAvailable();
        String sql = "INSERT INTO memory_index (content, record_id, memory_type, importance) VALUES (?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, content);
            stmt.setLong(2, recordId);
            stmt.setString(3, type.wireName());
            stmt.setDouble(4, importance);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to index record " + recordId, e);
        }
    }

    @Override
    public synchronized List<Hit> search(String query, int limit, MemoryType typeFilter, double minImportance) {
        requireAvailable();
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }

        String sql = """
            SELECT record_id, bm25(memory_index) AS rank
            FROM memory_index
            WHERE memory_index MATCH ?
              AND importance >= ?
            """ + (typeFilter != null ? "  AND memory_type = ?\n" : "") + """
            ORDER BY rank
            LIMIT ?
            """;

        List<Hit> hits = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            int i = 1;
            stmt.setString(i++, buildFtsQuery(query));
            stmt.setDouble(i++, minImportance);
            if (typeFilter != null) {
                stmt.setString(i++, typeFilter.wireName());
            }
            stmt.setInt(i, limit);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    double rank = Math.abs(rs.getDouble("rank"));
                    hits.add(new Hit(rs.getLong("record_id"), 1.0 / (1.0 + rank)));
                }
            }
        } catch (SQLException e) {
            log.debug("FTS search failed, falling back to LIKE search: {}", e.getMessage());
            return searchFallback(query, limit, typeFilter, minImportance);
        }
        return hits;
    }

    private List<Hit> searchFallback(String query, int limit, MemoryType typeFilter, double minImportance) {
        String likePattern = "%" + query.replace("%", "").replace("_", "") + "%";
        String sql = """
            SELECT record_id
            FROM memory_index
            WHERE content LIKE ?
              AND importance >= ?
            """ + (typeFilter != null ? "  AND memory_type = ?\n" : "") + """
            ORDER BY rowid DESC
            LIMIT ?
            """;

        List<Hit> hits = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            int i = 1;
            stmt.setString(i++, likePattern);
            stmt.setDouble(i++, minImportance);
            if (typeFilter != null) {
                stmt.setString(i++, typeFilter.wireName());
            }
            stmt.setInt(i, limit);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    hits.add(new Hit(rs.getLong("record_id"), FALLBACK_SCORE));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Fallback search failed", e);
        }
        return hits;
    }

    @PreDestroy
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("FTS5 similarity index closed");
            } catch (SQLException e) {
                log.error("Failed to close FTS5 index connection", e);
            }
            connection = null;
        }
    }

    private void closeQuietly() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.debug("Ignoring close failure after init error: {}", e.getMessage());
            }
            connection = null;
        }
    }

    private void requireAvailable() {
        if (connection == null) {
            throw new IllegalStateException("FTS5 index is not available");
        }
    }

    /** Builds an OR-joined prefix query; FTS5 operators in the input are stripped. */
    static String buildFtsQuery(String query) {
        String[] words = query.trim().split("\\s+");
        StringJoiner fts = new StringJoiner(" OR ");
        for (String word : words) {
            String clean = word.replaceAll("[\"'*(){}\\[\\]^~:+\\-.,;!?]", "").trim();
            if (!clean.isEmpty()) {
                fts.add("\"" + clean + "\"*");
            }
        }
        String result = fts.toString();
        return result.isEmpty() ? "\"" + query.replaceAll("[\"']", "") + "\"" : result;
    }
}
