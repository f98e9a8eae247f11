package com.polychaeta.bot.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polychaeta.bot.model.JobAction;
import com.polychaeta.bot.model.ScheduledJob;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of scheduled jobs, one row per job id.
 *
 * Every call opens its own connection and commits before returning. Callers
 * are expected to serialize writes; {@link com.polychaeta.bot.scheduler.JobScheduler} does.
 */
public final class JobDao {
    private static final TypeReference<List<String>> ARGS_TYPE = new TypeReference<>() {
    };

    private final Database db;
    private final ObjectMapper mapper;

    public JobDao(Database db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
    }

    /**
     * Inserts the job, or replaces the stored one with the same id.
     */
    public void put(ScheduledJob job) {
        long now = Instant.now().toEpochMilli();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT INTO jobs (id, run_at, action, args, created_at, updated_at)
                     VALUES (?, ?, ?, ?, ?, ?)
                     ON CONFLICT(id) DO UPDATE SET
                         run_at = excluded.run_at,
                         action = excluded.action,
                         args = excluded.args,
                         updated_at = excluded.updated_at
                     """)) {
            ps.setString(1, job.id);
            ps.setLong(2, job.runAt.toEpochMilli());
            ps.setString(3, job.action.name());
            ps.setString(4, writeArgs(job.args));
            ps.setLong(5, now);
            ps.setLong(6, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("put failed for job " + job.id, e);
        }
    }

    public Optional<ScheduledJob> get(String id) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT id, run_at, action, args FROM jobs WHERE id = ?
                     """)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readJob(rs));
            }
        } catch (SQLException e) {
            throw new JobStoreException("get failed for job " + id, e);
        }
    }

    /**
     * Returns true if a row was removed.
     */
    public boolean delete(String id) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
            ps.setString(1, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new JobStoreException("delete failed for job " + id, e);
        }
    }

    /**
     * All stored jobs, oldest run time first.
     */
    public List<ScheduledJob> list() {
        List<ScheduledJob> jobs = new ArrayList<>();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT id, run_at, action, args
                     FROM jobs
                     ORDER BY run_at ASC, id ASC
                     """);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(readJob(rs));
            }
        } catch (SQLException e) {
            throw new JobStoreException("list failed", e);
        }
        return jobs;
    }

    private ScheduledJob readJob(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        Instant runAt = Instant.ofEpochMilli(rs.getLong("run_at"));
        JobAction action = JobAction.valueOf(rs.getString("action"));
        List<String> args = readArgs(id, rs.getString("args"));
        return new ScheduledJob(id, runAt, action, args);
    }

    private String writeArgs(List<String> args) {
        try {
            return mapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable job args: " + args, e);
        }
    }

    private List<String> readArgs(String id, String json) throws SQLException {
        try {
            return mapper.readValue(json, ARGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt args for job " + id + ": " + json, e);
        }
    }
}
