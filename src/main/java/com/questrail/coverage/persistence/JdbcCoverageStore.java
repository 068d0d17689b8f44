package com.questrail.coverage.persistence;

import com.questrail.coverage.model.Coordinate;
import com.questrail.coverage.model.Fence;
import com.questrail.coverage.model.RadioTechnology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * JdbcCoverageStore
 * =============================================================================
 * {@link FencePersistenceService} on an embedded relational database (H2 in
 * production and tests).
 *
 * <h2>Schema</h2>
 * <pre>
 *   coverage_session(id, test_uuid, loop_uuid, started_at_us, anchor_at_us, finalized_at_us)
 *   coverage_fence(fence_id, session_id -&gt; coverage_session ON DELETE CASCADE,
 *                  entered_at_us, exited_at_us, latitude, longitude, accuracy,
 *                  avg_ping_ms, technology, radius_m)
 * </pre>
 * All instants are stored as microseconds since the epoch.
 *
 * <h2>Target sub-session of a write</h2>
 * Writes without an explicit identity go to the most recently started
 * unfinished sub-session, falling back to the most recent one overall.
 */
public final class JdbcCoverageStore implements FencePersistenceService {

    private static final Logger log = LoggerFactory.getLogger(JdbcCoverageStore.class);

    private static final String CREATE_SESSION_TABLE =
            "CREATE TABLE IF NOT EXISTS coverage_session ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " test_uuid VARCHAR(64),"
                    + " loop_uuid VARCHAR(64),"
                    + " started_at_us BIGINT NOT NULL,"
                    + " anchor_at_us BIGINT,"
                    + " finalized_at_us BIGINT)";

    private static final String CREATE_FENCE_TABLE =
            "CREATE TABLE IF NOT EXISTS coverage_fence ("
                    + " fence_id VARCHAR(36) PRIMARY KEY,"
                    + " session_id BIGINT NOT NULL REFERENCES coverage_session(id) ON DELETE CASCADE,"
                    + " entered_at_us BIGINT NOT NULL,"
                    + " exited_at_us BIGINT,"
                    + " latitude DOUBLE PRECISION NOT NULL,"
                    + " longitude DOUBLE PRECISION NOT NULL,"
                    + " accuracy DOUBLE PRECISION,"
                    + " avg_ping_ms INT,"
                    + " technology VARCHAR(32),"
                    + " radius_m DOUBLE PRECISION NOT NULL)";

    private static final String LATEST_UNFINISHED =
            "SELECT id FROM coverage_session WHERE finalized_at_us IS NULL ORDER BY started_at_us DESC, id DESC LIMIT 1";

    private static final String MOST_RECENT =
            "SELECT id FROM coverage_session ORDER BY started_at_us DESC, id DESC LIMIT 1";

    private static final String BY_TEST_UUID =
            "SELECT id FROM coverage_session WHERE test_uuid = ? ORDER BY id DESC LIMIT 1";

    private static final String MERGE_FENCE =
            "MERGE INTO coverage_fence (fence_id, session_id, entered_at_us, exited_at_us, latitude, longitude,"
                    + " accuracy, avg_ping_ms, technology, radius_m) KEY (fence_id)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final DataSource dataSource;

    public JdbcCoverageStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Creates the tables if they do not exist yet.
     */
    public void initializeSchema() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(CREATE_SESSION_TABLE);
            statement.execute(CREATE_FENCE_TABLE);
        } catch (SQLException e) {
            throw new PersistenceException("could not create coverage tables", e);
        }
    }

    // -------------------------------------------------------------------------
    // FencePersistenceService
    // -------------------------------------------------------------------------

    @Override
    public void save(Fence fence) {
        Objects.requireNonNull(fence, "fence");
        FenceRecord record = FenceRecord.from(fence);

        try (Connection connection = dataSource.getConnection()) {
            OptionalLong sessionId = OptionalLong.empty();
            if (fence.sessionUuid() != null) {
                sessionId = queryId(connection, BY_TEST_UUID, fence.sessionUuid());
            }
            if (sessionId.isEmpty()) {
                sessionId = queryId(connection, LATEST_UNFINISHED, null);
            }
            if (sessionId.isEmpty()) {
                sessionId = queryId(connection, MOST_RECENT, null);
            }
            if (sessionId.isEmpty()) {
                throw new PersistenceException("no coverage session to store fence " + fence.id() + " in");
            }

            try (PreparedStatement ps = connection.prepareStatement(MERGE_FENCE)) {
                ps.setString(1, record.fenceId().toString());
                ps.setLong(2, sessionId.getAsLong());
                ps.setLong(3, EpochMicros.of(record.dateEntered()));
                setNullableMicros(ps, 4, record.dateExited());
                ps.setDouble(5, record.coordinate().latitude());
                ps.setDouble(6, record.coordinate().longitude());
                if (record.accuracy() == null) {
                    ps.setNull(7, Types.DOUBLE);
                } else {
                    ps.setDouble(7, record.accuracy());
                }
                if (record.avgPingMillis() == null) {
                    ps.setNull(8, Types.INTEGER);
                } else {
                    ps.setInt(8, record.avgPingMillis());
                }
                ps.setString(9, record.technology() == null ? null : record.technology().name());
                ps.setDouble(10, record.radiusMeters());
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new PersistenceException("could not store fence " + fence.id(), e);
        }
    }

    @Override
    public void sessionStarted(Instant at) {
        insertSession(null, null, at, null);
    }

    @Override
    public void sessionAssigned(String testUuid, String loopUuid, Instant anchor) {
        Objects.requireNonNull(testUuid, "testUuid");
        Objects.requireNonNull(anchor, "anchor");

        try (Connection connection = dataSource.getConnection()) {
            OptionalLong sessionId = queryId(connection, LATEST_UNFINISHED, null);
            if (sessionId.isEmpty()) {
                insertSession(testUuid, loopUuid, anchor, anchor);
                return;
            }
            try (PreparedStatement ps = connection.prepareStatement(
                    "UPDATE coverage_session SET test_uuid = ?, loop_uuid = ?, anchor_at_us = ? WHERE id = ?")) {
                ps.setString(1, testUuid);
                ps.setString(2, loopUuid);
                ps.setLong(3, EpochMicros.of(anchor));
                ps.setLong(4, sessionId.getAsLong());
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new PersistenceException("could not assign " + testUuid + " to the open coverage session", e);
        }
    }

    @Override
    public void sessionFinalized(Instant at) {
        Objects.requireNonNull(at, "at");

        try (Connection connection = dataSource.getConnection()) {
            OptionalLong sessionId = queryId(connection, LATEST_UNFINISHED, null);
            if (sessionId.isEmpty()) {
                log.debug("No unfinished coverage session to finalize");
                return;
            }
            finalizeSession(connection, sessionId.getAsLong(), at);
        } catch (SQLException e) {
            throw new PersistenceException("could not finalize the open coverage session", e);
        }
    }

    // -------------------------------------------------------------------------
    // Queries used by submission and resend
    // -------------------------------------------------------------------------

    /**
     * Every stored sub-session with its fences, oldest first.
     */
    public List<StoredSession> loadSessions() {
        try (Connection connection = dataSource.getConnection()) {
            Map<Long, List<FenceRecord>> fencesBySession = new LinkedHashMap<>();
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT fence_id, session_id, entered_at_us, exited_at_us, latitude, longitude, accuracy,"
                            + " avg_ping_ms, technology, radius_m FROM coverage_fence ORDER BY entered_at_us, fence_id");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    fencesBySession.computeIfAbsent(rs.getLong("session_id"), id -> new ArrayList<>())
                            .add(readFence(rs));
                }
            }

            List<StoredSession> sessions = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT id, test_uuid, loop_uuid, started_at_us, anchor_at_us, finalized_at_us"
                            + " FROM coverage_session ORDER BY started_at_us, id");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long id = rs.getLong("id");
                    sessions.add(new StoredSession(
                            id,
                            rs.getString("test_uuid"),
                            rs.getString("loop_uuid"),
                            EpochMicros.toInstant(rs.getLong("started_at_us")),
                            readNullableMicros(rs, "anchor_at_us"),
                            readNullableMicros(rs, "finalized_at_us"),
                            fencesBySession.getOrDefault(id, List.of())));
                }
            }
            return sessions;
        } catch (SQLException e) {
            throw new PersistenceException("could not load coverage sessions", e);
        }
    }

    public Optional<StoredSession> findByTestUuid(String testUuid) {
        return loadSessions().stream().filter(s -> testUuid.equals(s.testUuid())).findFirst();
    }

    /**
     * Deletes a sub-session and, by cascade, its fences.
     */
    public void deleteSession(long sessionId) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement("DELETE FROM coverage_session WHERE id = ?")) {
            ps.setLong(1, sessionId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("could not delete coverage session " + sessionId, e);
        }
    }

    /**
     * @return number of sub-sessions deleted
     */
    public int deleteSessionsByTestUuid(String testUuid) {
        Objects.requireNonNull(testUuid, "testUuid");
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement("DELETE FROM coverage_session WHERE test_uuid = ?")) {
            ps.setString(1, testUuid);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("could not delete coverage session " + testUuid, e);
        }
    }

    public void finalizeSession(long sessionId, Instant at) {
        try (Connection connection = dataSource.getConnection()) {
            finalizeSession(connection, sessionId, at);
        } catch (SQLException e) {
            throw new PersistenceException("could not finalize coverage session " + sessionId, e);
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void insertSession(String testUuid, String loopUuid, Instant startedAt, Instant anchor) {
        Objects.requireNonNull(startedAt, "startedAt");
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(
                     "INSERT INTO coverage_session (test_uuid, loop_uuid, started_at_us, anchor_at_us) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, testUuid);
            ps.setString(2, loopUuid);
            ps.setLong(3, EpochMicros.of(startedAt));
            setNullableMicros(ps, 4, anchor);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("could not start coverage session", e);
        }
    }

    private static void finalizeSession(Connection connection, long sessionId, Instant at) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE coverage_session SET finalized_at_us = ? WHERE id = ?")) {
            ps.setLong(1, EpochMicros.of(at));
            ps.setLong(2, sessionId);
            ps.executeUpdate();
        }
    }

    private static OptionalLong queryId(Connection connection, String sql, String parameter) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            if (parameter != null) {
                ps.setString(1, parameter);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        }
    }

    private static FenceRecord readFence(ResultSet rs) throws SQLException {
        double accuracy = rs.getDouble("accuracy");
        Double nullableAccuracy = rs.wasNull() ? null : accuracy;
        int avgPing = rs.getInt("avg_ping_ms");
        Integer nullableAvgPing = rs.wasNull() ? null : avgPing;
        String technology = rs.getString("technology");

        return new FenceRecord(
                UUID.fromString(rs.getString("fence_id")),
                EpochMicros.toInstant(rs.getLong("entered_at_us")),
                new Coordinate(rs.getDouble("latitude"), rs.getDouble("longitude")),
                nullableAccuracy,
                nullableAvgPing,
                technology == null ? null : RadioTechnology.fromCode(technology).orElse(null),
                readNullableMicros(rs, "exited_at_us"),
                rs.getDouble("radius_m"));
    }

    private static Instant readNullableMicros(ResultSet rs, String column) throws SQLException {
        long micros = rs.getLong(column);
        return rs.wasNull() ? null : EpochMicros.toInstant(micros);
    }

    private static void setNullableMicros(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, EpochMicros.of(instant));
        }
    }
}
