package io.agentmind.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed long-term memory.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code memories}: append-only records with importance, JSON tags/metadata and access bookkeeping</li>
 *   <li>{@code user_preferences}: one row per preference key, upserted atomically</li>
 *   <li>{@code facts}: categorized facts with a confidence score</li>
 * </ul>
 *
 * <p>Similarity retrieval is delegated to a {@link SimilarityIndex}. Writes always land in
 * {@code memories} first; indexing is best effort.</p>
 */
public class SqliteLongTermMemory implements LongTermMemory {

    private static final Logger log = LoggerFactory.getLogger(SqliteLongTermMemory.class);
    private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String RECORD_COLUMNS =
            "id, content, memory_type, importance_score, tags, created_at, last_accessed, access_count, metadata";

    private final String dbPath;
    private final SimilarityIndex similarityIndex;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();
    private Connection connection;

    public SqliteLongTermMemory(String dbPath, SimilarityIndex similarityIndex, ObjectMapper objectMapper) {
        this.dbPath = dbPath;
        this.similarityIndex = similarityIndex;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        lock.lock();
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            createSchema();
            log.info("Long-term memory initialized at: {} (index: {})", dbPath, similarityIndex.name());
        } catch (SQLException e) {
            log.error("Failed to initialize long-term memory at {}", dbPath, e);
            throw new LongTermMemoryException("Long-term memory initialization failed", e);
        } finally {
            lock.unlock();
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memories (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    content TEXT NOT NULL,
                    memory_type TEXT NOT NULL,
                    importance_score REAL NOT NULL DEFAULT 0.5,
                    tags TEXT NOT NULL DEFAULT '[]',
                    created_at TEXT NOT NULL,
                    last_accessed TEXT NOT NULL,
                    access_count INTEGER NOT NULL DEFAULT 0,
                    metadata TEXT NOT NULL DEFAULT '{}'
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_type ON memories(memory_type)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_importance ON memories(importance_score)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS user_preferences (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    preference_key TEXT NOT NULL UNIQUE,
                    value TEXT NOT NULL,
                    created_at TEXT NOT NULL,
                    updated_at TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS facts (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    fact_content TEXT NOT NULL,
                    category TEXT NOT NULL,
                    confidence_score REAL NOT NULL DEFAULT 1.0,
                    source TEXT,
                    created_at TEXT NOT NULL,
                    verified INTEGER NOT NULL DEFAULT 0
                )
                """);
        }
    }

    @Override
    public StoredMemory store(String content, MemoryType type, double importance,
                              Collection<String> tags, Map<String, Object> metadata) {
        double score = MemoryRecord.clamp(importance);
        String now = Instant.now().toString();
        String sql = """
            INSERT INTO memories (content, memory_type, importance_score, tags, created_at, last_accessed, access_count, metadata)
            VALUES (?, ?, ?, ?, ?, ?, 0, ?)
            """;

        long id;
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, content);
            stmt.setString(2, type.wireName());
            stmt.setDouble(3, score);
            stmt.setString(4, toJson(tags == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(tags))));
            stmt.setString(5, now);
            stmt.setString(6, now);
            stmt.setString(7, toJson(metadata == null ? Map.of() : metadata));
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for memory record");
                }
                id = keys.getLong(1);
            }
        } catch (SQLException e) {
            log.error("Failed to store {} memory", type, e);
            throw new LongTermMemoryException("Failed to store memory", e);
        } finally {
            lock.unlock();
        }

        boolean indexed = false;
        try {
            if (similarityIndex.isAvailable()) {
                similarityIndex.index(id, content, type, score);
                indexed = true;
            } else {
                log.warn("Similarity index '{}' unavailable, memory {} stored without index", similarityIndex.name(), id);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to index memory {}: {}", id, e.getMessage());
        }

        log.debug("Stored memory: id={}, type={}, importance={}, indexed={}", id, type, score, indexed);
        return new StoredMemory(id, indexed);
    }

    @Override
    public List<ScoredMemory> search(String query, int limit, MemoryType typeFilter, double minImportance) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        if (!similarityIndex.isAvailable()) {
            log.debug("Similarity index '{}' unavailable, returning no results", similarityIndex.name());
            return List.of();
        }

        List<SimilarityIndex.Hit> hits;
        try {
            hits = similarityIndex.search(query, limit, typeFilter, minImportance);
        } catch (RuntimeException e) {
            log.warn("Memory search failed for query '{}': {}", query, e.getMessage());
            return List.of();
        }

        List<ScoredMemory> results = new ArrayList<>();
        lock.lock();
        try {
            for (SimilarityIndex.Hit hit : hits) {
                Optional<MemoryRecord> found = load(hit.recordId());
                if (found.isEmpty()) continue;
                MemoryRecord record = found.get();
                if (typeFilter != null && record.type() != typeFilter) continue;
                if (record.importanceScore() < minImportance) continue;
                results.add(new ScoredMemory(touch(record), hit.score()));
                if (results.size() >= limit) break;
            }
        } catch (SQLException e) {
            log.warn("Failed to load search results: {}", e.getMessage());
            return List.of();
        } finally {
            lock.unlock();
        }
        return results;
    }

    @Override
    public Optional<MemoryRecord> get(long id) {
        lock.lock();
        try {
            return load(id).map(this::touchUnchecked);
        } catch (SQLException e) {
            log.error("Failed to get memory: id={}", id, e);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setPreference(String key, String value) {
        String now = Instant.now().toString();
        String sql = """
            INSERT INTO user_preferences (preference_key, value, created_at, updated_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(preference_key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at
            """;
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, key);
            stmt.setString(2, value);
            stmt.setString(3, now);
            stmt.setString(4, now);
            stmt.executeUpdate();
            log.debug("Stored preference: key='{}'", key);
        } catch (SQLException e) {
            log.error("Failed to store preference: key='{}'", key, e);
            throw new LongTermMemoryException("Failed to store preference " + key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Preference> getPreference(String key) {
        String sql = "SELECT preference_key, value, created_at, updated_at FROM user_preferences WHERE preference_key = ?";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(toPreference(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to get preference: key='{}'", key, e);
        } finally {
            lock.unlock();
        }
        return Optional.empty();
    }

    @Override
    public List<Preference> listPreferences() {
        List<Preference> results = new ArrayList<>();
        lock.lock();
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery(
                     "SELECT preference_key, value, created_at, updated_at FROM user_preferences ORDER BY preference_key")) {
            while (rs.next()) {
                results.add(toPreference(rs));
            }
        } catch (SQLException e) {
            log.error("Failed to list preferences", e);
        } finally {
            lock.unlock();
        }
        return results;
    }

    @Override
    public long storeFact(String content, String category, double confidence, String source) {
        String sql = """
            INSERT INTO facts (fact_content, category, confidence_score, source, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, content);
            stmt.setString(2, category);
            stmt.setDouble(3, MemoryRecord.clamp(confidence));
            stmt.setString(4, source);
            stmt.setString(5, Instant.now().toString());
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for fact");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            log.error("Failed to store fact in category '{}'", category, e);
            throw new LongTermMemoryException("Failed to store fact", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Fact> factsByCategory(String category) {
        String sql = """
            SELECT id, fact_content, category, confidence_score, source, created_at, verified
            FROM facts
            WHERE category = ?
            ORDER BY confidence_score DESC, id
            """;
        List<Fact> results = new ArrayList<>();
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, category);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new Fact(
                            rs.getLong("id"),
                            rs.getString("fact_content"),
                            rs.getString("category"),
                            rs.getDouble("confidence_score"),
                            rs.getString("source"),
                            Instant.parse(rs.getString("created_at")),
                            rs.getInt("verified") != 0));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list facts for category '{}'", category, e);
        } finally {
            lock.unlock();
        }
        return results;
    }

    @Override
    public MemoryStats stats() {
        Map<MemoryType, Long> byType = new EnumMap<>(MemoryType.class);
        long total = 0;
        long preferences = 0;
        long facts = 0;
        lock.lock();
        try (var stmt = connection.createStatement()) {
            try (var rs = stmt.executeQuery("SELECT memory_type, COUNT(*) FROM memories GROUP BY memory_type")) {
                while (rs.next()) {
                    long count = rs.getLong(2);
                    byType.merge(MemoryType.fromString(rs.getString(1)), count, Long::sum);
                    total += count;
                }
            }
            preferences = count(stmt, "SELECT COUNT(*) FROM user_preferences");
            facts = count(stmt, "SELECT COUNT(*) FROM facts");
        } catch (SQLException e) {
            log.error("Failed to compute memory stats", e);
        } finally {
            lock.unlock();
        }
        return new MemoryStats(total, Map.copyOf(byType), preferences, facts,
                similarityIndex.name(), similarityIndex.isAvailable());
    }

    @Override
    public boolean healthCheck() {
        lock.lock();
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            return false;
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void close() {
        lock.lock();
        try {
            if (connection != null) {
                connection.close();
                connection = null;
                log.info("Long-term memory closed");
            }
        } catch (SQLException e) {
            log.error("Failed to close SQLite connection", e);
        } finally {
            lock.unlock();
        }
    }

    private long count(Statement stmt, String sql) throws SQLException {
        try (var rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private Optional<MemoryRecord> load(long id) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT " + RECORD_COLUMNS + " FROM memories WHERE id = ?")) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toRecord(rs)) : Optional.empty();
            }
        }
    }

    /** Records an access and returns the record with updated bookkeeping. */
    private MemoryRecord touch(MemoryRecord record) throws SQLException {
        Instant now = Instant.now();
        try (PreparedStatement stmt = connection.prepareStatement(
                "UPDATE memories SET last_accessed = ?, access_count = access_count + 1 WHERE id = ?")) {
            stmt.setString(1, now.toString());
            stmt.setLong(2, record.id());
            stmt.executeUpdate();
        }
        return new MemoryRecord(record.id(), record.content(), record.type(), record.importanceScore(),
                record.tags(), record.createdAt(), now, record.accessCount() + 1, record.metadata());
    }

    private MemoryRecord touchUnchecked(MemoryRecord record) {
        try {
            return touch(record);
        } catch (SQLException e) {
            log.warn("Failed to update access bookkeeping for memory {}: {}", record.id(), e.getMessage());
            return record;
        }
    }

    private MemoryRecord toRecord(ResultSet rs) throws SQLException {
        return new MemoryRecord(
                rs.getLong("id"),
                rs.getString("content"),
                MemoryType.fromString(rs.getString("memory_type")),
                rs.getDouble("importance_score"),
                Set.copyOf(fromJson(rs.getString("tags"), TAGS_TYPE, List.of())),
                Instant.parse(rs.getString("created_at")),
                Instant.parse(rs.getString("last_accessed")),
                rs.getInt("access_count"),
                fromJson(rs.getString("metadata"), METADATA_TYPE, Map.of()));
    }

    private Preference toPreference(ResultSet rs) throws SQLException {
        return new Preference(
                rs.getString("preference_key"),
                rs.getString("value"),
                Instant.parse(rs.getString("created_at")),
                Instant.parse(rs.getString("updated_at")));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LongTermMemoryException("Failed to serialize memory field", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            T value = objectMapper.readValue(json, type);
            return value != null ? value : fallback;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable memory field: {}", e.getOriginalMessage());
            return fallback;
        }
    }
}
