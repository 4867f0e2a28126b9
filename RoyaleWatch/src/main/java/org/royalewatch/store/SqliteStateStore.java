package org.royalewatch.store;

import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.MonitorCursor;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.model.SubjectStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQLite backed {@link StateStore}. A subject row carries its cursor and a JSON snapshot of its
 * aggregate; every counted battle is kept in a ledger table. Multi-statement writes run in one
 * transaction, so a crash leaves either the previous or the new state.
 */
public class SqliteStateStore implements StateStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteStateStore.class);

    private final String url;

    public SqliteStateStore(String databasePath) throws StateStoreException {
        this.url = "jdbc:sqlite:" + databasePath;
        createTables();
    }

    protected Connection connect() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(5000);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.FULL);
        config.enforceForeignKeys(true);
        return DriverManager.getConnection(url, config.toProperties());
    }

    private void createTables() throws StateStoreException {
        String sqlSubjects = "CREATE TABLE IF NOT EXISTS subjects (" +
                "tag TEXT PRIMARY KEY, " +
                "name TEXT NOT NULL, " +
                "status TEXT NOT NULL, " +
                "created_at INTEGER NOT NULL, " +
                "last_arena TEXT, " +
                "cursor_id TEXT, " +
                "cursor_time INTEGER, " +
                "fetch_sequence INTEGER NOT NULL DEFAULT 0, " +
                "aggregate TEXT NOT NULL, " +
                "status_message_id TEXT, " +
                "updated_at INTEGER NOT NULL" +
                ");";

        String sqlBattles = "CREATE TABLE IF NOT EXISTS battles (" +
                "subject_tag TEXT NOT NULL REFERENCES subjects(tag) ON DELETE CASCADE, " +
                "battle_id TEXT NOT NULL, " +
                "battle_time INTEGER NOT NULL, " +
                "payload TEXT NOT NULL, " +
                "PRIMARY KEY (subject_tag, battle_id)" +
                ");";

        String sqlBattleIndex = "CREATE INDEX IF NOT EXISTS idx_battles_time ON battles(subject_tag, battle_time DESC);";

        try (Connection conn = connect();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sqlSubjects);
            stmt.execute(sqlBattles);
            stmt.execute(sqlBattleIndex);
            try {
                stmt.execute("ALTER TABLE subjects ADD COLUMN status_message_id TEXT");
            } catch (SQLException e) {
                log.debug("Column status_message_id already present");
            }
        } catch (SQLException e) {
            throw new StateStoreException("Cannot initialize database " + url, e);
        }
    }

    // --- LOAD ---
    @Override
    public Map<String, SubjectState> loadAll() throws StateStoreException {
        Map<String, SubjectState> states = new LinkedHashMap<>();
        String sql = "SELECT tag, name, status, created_at, last_arena, cursor_id, cursor_time, fetch_sequence, aggregate " +
                "FROM subjects ORDER BY created_at, tag";
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                String tag = rs.getString("tag");
                Subject subject = new Subject(
                        tag,
                        rs.getString("name"),
                        SubjectStatus.valueOf(rs.getString("status")),
                        Instant.ofEpochMilli(rs.getLong("created_at")),
                        rs.getString("last_arena"));
                long cursorTime = rs.getLong("cursor_time");
                Instant cursorAt = rs.wasNull() ? null : Instant.ofEpochMilli(cursorTime);
                MonitorCursor cursor = new MonitorCursor(rs.getString("cursor_id"), cursorAt, rs.getLong("fetch_sequence"));
                SubjectAggregate aggregate = JsonCodec.decodeAggregate(rs.getString("aggregate"));
                states.put(tag, new SubjectState(subject, cursor, aggregate, countedIds(conn, tag)));
            }
        } catch (SQLException | RuntimeException e) {
            throw new StateStoreException("Cannot load monitored subjects", e);
        }
        log.info("Loaded {} monitored subject(s) from {}", states.size(), url);
        return states;
    }

    private Set<String> countedIds(Connection conn, String tag) throws SQLException {
        Set<String> ids = new HashSet<>();
        try (PreparedStatement pstmt = conn.prepareStatement("SELECT battle_id FROM battles WHERE subject_tag = ?")) {
            pstmt.setString(1, tag);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) ids.add(rs.getString(1));
            }
        }
        return ids;
    }

    // --- SUBJECTS ---
    @Override
    public SubjectState createSubject(Subject subject) throws StateStoreException {
        MonitorCursor cursor = MonitorCursor.initial();
        SubjectAggregate aggregate = new SubjectAggregate();
        String sql = "INSERT INTO subjects(tag, name, status, created_at, last_arena, cursor_id, cursor_time, " +
                "fetch_sequence, aggregate, updated_at) VALUES(?, ?, ?, ?, ?, NULL, NULL, 0, ?, ?)";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, subject.tag());
            pstmt.setString(2, subject.name());
            pstmt.setString(3, subject.status().name());
            pstmt.setLong(4, subject.createdAt().toEpochMilli());
            pstmt.setString(5, subject.lastArena());
            pstmt.setString(6, JsonCodec.encodeAggregate(aggregate));
            pstmt.setLong(7, System.currentTimeMillis());
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("Cannot create subject #" + subject.tag(), e);
        }
        return new SubjectState(subject, cursor, aggregate, new HashSet<>());
    }

    @Override
    public void deleteSubject(String tag) throws StateStoreException {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement battles = conn.prepareStatement("DELETE FROM battles WHERE subject_tag = ?");
                 PreparedStatement subject = conn.prepareStatement("DELETE FROM subjects WHERE tag = ?")) {
                battles.setString(1, tag);
                battles.executeUpdate();
                subject.setString(1, tag);
                subject.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Cannot delete subject #" + tag, e);
        }
    }

    @Override
    public void updateStatus(String tag, SubjectStatus status) throws StateStoreException {
        String sql = "UPDATE subjects SET status = ?, updated_at = ? WHERE tag = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, status.name());
            pstmt.setLong(2, System.currentTimeMillis());
            pstmt.setString(3, tag);
            if (pstmt.executeUpdate() == 0) throw new SQLException("No subject row for #" + tag);
        } catch (SQLException e) {
            throw new StateStoreException("Cannot change status of #" + tag, e);
        }
    }

    @Override
    public void updateProfile(String tag, String name, String arena) throws StateStoreException {
        String sql = "UPDATE subjects SET name = COALESCE(?, name), last_arena = COALESCE(?, last_arena), updated_at = ? WHERE tag = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, name);
            pstmt.setString(2, arena);
            pstmt.setLong(3, System.currentTimeMillis());
            pstmt.setString(4, tag);
            if (pstmt.executeUpdate() == 0) throw new SQLException("No subject row for #" + tag);
        } catch (SQLException e) {
            throw new StateStoreException("Cannot refresh profile of #" + tag, e);
        }
    }

    // --- STATUS MESSAGES ---
    @Override
    public Map<String, String> loadStatusMessages() throws StateStoreException {
        Map<String, String> ids = new LinkedHashMap<>();
        String sql = "SELECT tag, status_message_id FROM subjects WHERE status_message_id IS NOT NULL";
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                ids.put(rs.getString("tag"), rs.getString("status_message_id"));
            }
        } catch (SQLException e) {
            throw new StateStoreException("Cannot load status messages", e);
        }
        return ids;
    }

    @Override
    public void saveStatusMessage(String tag, String messageId) throws StateStoreException {
        String sql = "UPDATE subjects SET status_message_id = ?, updated_at = ? WHERE tag = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, messageId);
            pstmt.setLong(2, System.currentTimeMillis());
            pstmt.setString(3, tag);
            if (pstmt.executeUpdate() == 0) throw new SQLException("No subject row for #" + tag);
        } catch (SQLException e) {
            throw new StateStoreException("Cannot save status message of #" + tag, e);
        }
    }

    // --- CYCLE COMMIT ---
    @Override
    public void commit(String tag, MonitorCursor cursor, SubjectAggregate aggregate, List<BattleRecord> countedBattles)
            throws StateStoreException {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                insertBattles(conn, tag, countedBattles);
                writeAggregate(conn, tag, aggregate);
                writeCursor(conn, tag, cursor);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            throw new StateStoreException("Commit failed for #" + tag, e);
        }
    }

    protected void insertBattles(Connection conn, String tag, List<BattleRecord> battles) throws SQLException {
        if (battles.isEmpty()) return;
        String sql = "INSERT INTO battles(subject_tag, battle_id, battle_time, payload) VALUES(?, ?, ?, ?)";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            for (BattleRecord battle : battles) {
                pstmt.setString(1, tag);
                pstmt.setString(2, battle.id());
                pstmt.setLong(3, battle.timestamp().toEpochMilli());
                pstmt.setString(4, JsonCodec.encodeBattle(battle));
                pstmt.addBatch();
            }
            pstmt.executeBatch();
        }
    }

    protected void writeAggregate(Connection conn, String tag, SubjectAggregate aggregate) throws SQLException {
        String sql = "UPDATE subjects SET aggregate = ?, updated_at = ? WHERE tag = ?";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, JsonCodec.encodeAggregate(aggregate));
            pstmt.setLong(2, System.currentTimeMillis());
            pstmt.setString(3, tag);
            if (pstmt.executeUpdate() == 0) throw new SQLException("No subject row for #" + tag);
        }
    }

    protected void writeCursor(Connection conn, String tag, MonitorCursor cursor) throws SQLException {
        String sql = "UPDATE subjects SET cursor_id = ?, cursor_time = ?, fetch_sequence = ? WHERE tag = ?";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, cursor.lastProcessedId());
            if (cursor.lastProcessedAt() != null) pstmt.setLong(2, cursor.lastProcessedAt().toEpochMilli());
            else pstmt.setNull(2, Types.INTEGER);
            pstmt.setLong(3, cursor.fetchSequence());
            pstmt.setString(4, tag);
            if (pstmt.executeUpdate() == 0) throw new SQLException("No subject row for #" + tag);
        }
    }

    // --- HISTORY ---
    @Override
    public List<BattleRecord> recentBattles(String tag, int limit) throws StateStoreException {
        List<BattleRecord> battles = new ArrayList<>();
        String sql = "SELECT payload FROM battles WHERE subject_tag = ? ORDER BY battle_time DESC LIMIT ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, tag);
            pstmt.setInt(2, limit);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) battles.add(JsonCodec.decodeBattle(rs.getString("payload")));
            }
        } catch (SQLException | RuntimeException e) {
            throw new StateStoreException("Cannot read battle history of #" + tag, e);
        }
        return battles;
    }
}
