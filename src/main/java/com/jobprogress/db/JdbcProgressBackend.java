package com.jobprogress.db;

import com.jobprogress.core.CompletionOutcome;
import com.jobprogress.core.JobRecord;
import com.jobprogress.core.JsonCodec;
import com.jobprogress.core.ProgressBackend;
import com.jobprogress.core.StoreAccessException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Progress backend on top of the H2 database.
 *
 * <p>Every mutating operation runs in its own transaction. Operations that touch an
 * existing job start by locking its {@code job_records} row with {@code SELECT ... FOR UPDATE},
 * which serializes writers of the same job while leaving other jobs untouched. Lock order
 * is always job row first, pending parts second, so concurrent writers cannot deadlock.</p>
 *
 * <p>{@link SQLException}s are rethrown as {@link StoreAccessException} after the
 * transaction has been rolled back.</p>
 */
public class JdbcProgressBackend implements ProgressBackend {
    private static final Logger logger = Logger.getLogger(JdbcProgressBackend.class.getName());

    private final Database database;

    public JdbcProgressBackend(Database database) {
        this.database = database;
    }

    /**
     * Register a job, replacing a previous one with the same id.
     * The MERGE keeps the original creation sequence when a job is re-registered.
     */
    @Override
    public void createJob(String jobId, String topic, List<String> encodedParts) {
        inTransaction("create job " + jobId, conn -> {
            String mergeSql = "MERGE INTO job_records (job_id, total, remaining, failed, metadata, topic, created_at) " +
                              "KEY (job_id) VALUES (?, ?, ?, FALSE, ?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(mergeSql)) {
                stmt.setString(1, jobId);
                stmt.setInt(2, encodedParts.size());
                stmt.setInt(3, encodedParts.size());
                stmt.setString(4, JsonCodec.encode(Map.of()));
                stmt.setString(5, topic);
                stmt.setTimestamp(6, Timestamp.valueOf(LocalDateTime.now()));
                stmt.executeUpdate();
            }

            deleteParts(conn, jobId);

            String insertSql = "INSERT INTO pending_parts (job_id, part_index, descriptor) VALUES (?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                for (int i = 0; i < encodedParts.size(); i++) {
                    stmt.setString(1, jobId);
                    stmt.setInt(2, i);
                    stmt.setString(3, encodedParts.get(i));
                    stmt.addBatch();
                }
                if (!encodedParts.isEmpty()) {
                    stmt.executeBatch();
                }
            }
            return null;
        });
    }

    /**
     * Atomically complete one part.
     *
     * <p>The DELETE of the pending row is the gate: only when it removed exactly one row
     * is remaining decremented. The job row lock taken first makes the whole sequence
     * linearizable for the job.</p>
     */
    @Override
    public CompletionOutcome completePart(String jobId, int index, boolean deleteWhenDone) {
        return inTransaction("complete part " + index + " of job " + jobId, conn -> {
            Integer total = lockJob(conn, jobId);
            if (total == null) {
                return CompletionOutcome.NO_SUCH_JOB;
            }
            if (index >= total) {
                return CompletionOutcome.INDEX_OUT_OF_RANGE;
            }

            String deleteSql = "DELETE FROM pending_parts WHERE job_id = ? AND part_index = ?";
            try (PreparedStatement stmt = conn.prepareStatement(deleteSql)) {
                stmt.setString(1, jobId);
                stmt.setInt(2, index);
                if (stmt.executeUpdate() == 0) {
                    return CompletionOutcome.ALREADY_COMPLETE;
                }
            }

            String decrementSql = "UPDATE job_records SET remaining = remaining - 1 WHERE job_id = ? AND remaining > 0";
            try (PreparedStatement stmt = conn.prepareStatement(decrementSql)) {
                stmt.setString(1, jobId);
                stmt.executeUpdate();
            }

            int remaining;
            try (PreparedStatement stmt = conn.prepareStatement("SELECT remaining FROM job_records WHERE job_id = ?")) {
                stmt.setString(1, jobId);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    remaining = rs.getInt("remaining");
                }
            }

            if (remaining > 0) {
                return CompletionOutcome.PART_COMPLETED;
            }
            if (deleteWhenDone) {
                deleteParts(conn, jobId);
                deleteRecord(conn, jobId);
            }
            return CompletionOutcome.JOB_COMPLETED;
        });
    }

    @Override
    public Optional<JobRecord> readJob(String jobId) {
        String sql = "SELECT job_id, total, remaining, failed, metadata, topic FROM job_records WHERE job_id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new JobRecord(
                            rs.getString("job_id"),
                            rs.getInt("total"),
                            rs.getInt("remaining"),
                            rs.getBoolean("failed"),
                            JsonCodec.decodeStrings(rs.getString("metadata")),
                            rs.getString("topic")));
                }
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to read job " + jobId, e);
        }
        return Optional.empty();
    }

    @Override
    public boolean mergeMetadata(String jobId, Map<String, String> updates, boolean markFailed) {
        return inTransaction("update metadata of job " + jobId, conn -> {
            String current;
            String selectSql = "SELECT metadata FROM job_records WHERE job_id = ? FOR UPDATE";
            try (PreparedStatement stmt = conn.prepareStatement(selectSql)) {
                stmt.setString(1, jobId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return false;
                    }
                    current = rs.getString("metadata");
                }
            }

            String updateSql = "UPDATE job_records SET metadata = ?, failed = (failed OR ?) WHERE job_id = ?";
            try (PreparedStatement stmt = conn.prepareStatement(updateSql)) {
                stmt.setString(1, JsonCodec.merge(current, updates));
                stmt.setBoolean(2, markFailed);
                stmt.setString(3, jobId);
                stmt.executeUpdate();
            }
            return true;
        });
    }

    @Override
    public PartState partState(String jobId, int index) {
        String sql = "SELECT r.total, p.part_index FROM job_records r " +
                     "LEFT JOIN pending_parts p ON p.job_id = r.job_id AND p.part_index = ? " +
                     "WHERE r.job_id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setInt(1, index);
            stmt.setString(2, jobId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return PartState.NO_SUCH_JOB;
                }
                if (index >= rs.getInt("total")) {
                    return PartState.INDEX_OUT_OF_RANGE;
                }
                rs.getInt("part_index");
                return rs.wasNull() ? PartState.COMPLETE : PartState.PENDING;
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to read part " + index + " of job " + jobId, e);
        }
    }

    @Override
    public List<PendingPart> pendingParts(String jobId, int afterIndex, int limit) {
        String sql = "SELECT part_index, descriptor FROM pending_parts " +
                     "WHERE job_id = ? AND part_index > ? ORDER BY part_index LIMIT ?";
        List<PendingPart> parts = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);
            stmt.setInt(2, afterIndex);
            stmt.setInt(3, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    parts.add(new PendingPart(rs.getInt("part_index"), rs.getString("descriptor")));
                }
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to list pending parts of job " + jobId, e);
        }
        return parts;
    }

    @Override
    public List<JobRef> jobIds(long afterSequence, int limit) {
        String sql = "SELECT job_id, seq FROM job_records WHERE seq > ? ORDER BY seq LIMIT ?";
        List<JobRef> refs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, afterSequence);
            stmt.setInt(2, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    refs.add(new JobRef(rs.getString("job_id"), rs.getLong("seq")));
                }
            }
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to list jobs", e);
        }
        return refs;
    }

    @Override
    public boolean deleteJob(String jobId) {
        return inTransaction("delete job " + jobId, conn -> {
            lockJob(conn, jobId);
            deleteParts(conn, jobId);
            return deleteRecord(conn, jobId);
        });
    }

    @Override
    public void close() {
        database.close();
    }

    // Locks the job row for the rest of the transaction; returns its total or null if absent
    private static Integer lockJob(Connection conn, String jobId) throws SQLException {
        String sql = "SELECT total FROM job_records WHERE job_id = ? FOR UPDATE";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt("total") : null;
            }
        }
    }

    private static void deleteParts(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM pending_parts WHERE job_id = ?")) {
            stmt.setString(1, jobId);
            stmt.executeUpdate();
        }
    }

    private static boolean deleteRecord(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM job_records WHERE job_id = ?")) {
            stmt.setString(1, jobId);
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * Run work in a single transaction, committing on success and rolling back on any
     * failure. Auto-commit is restored before the connection goes back to the pool.
     */
    private <T> T inTransaction(String description, TransactionWork<T> work) {
        Connection conn = null;
        try {
            conn = database.getConnection();
            conn.setAutoCommit(false); // Start transaction

            T result = work.execute(conn);

            conn.commit();
            return result;

        } catch (SQLException e) {
            if (conn != null) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    e.addSuppressed(rollbackEx);
                }
            }
            logger.log(Level.SEVERE, "Transaction rolled back: " + description, e);
            throw new StoreAccessException("Failed to " + description, e);
        } finally {
            if (conn != null) {
                try {
                    conn.setAutoCommit(true); // Restore auto-commit
                    conn.close();
                } catch (SQLException e) {
                    logger.log(Level.WARNING, "Error closing connection", e);
                }
            }
        }
    }

    @FunctionalInterface
    private interface TransactionWork<T> {
        T execute(Connection conn) throws SQLException;
    }
}
