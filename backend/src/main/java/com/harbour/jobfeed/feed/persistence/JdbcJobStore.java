package com.harbour.jobfeed.feed.persistence;

import com.harbour.jobfeed.feed.model.JobRecord;
import com.harbour.jobfeed.feed.model.JobRecordRef;
import com.harbour.jobfeed.feed.model.ScrapedJob;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Repository
public class JdbcJobStore implements JobStore {
    private static final RowMapper<JobRecord> JOB_RECORD_MAPPER = (rs, rowNum) -> {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new JobRecord(
            rs.getLong("id"),
            rs.getString("source_link"),
            rs.getString("date_posted"),
            rs.getString("company"),
            rs.getString("job_title"),
            rs.getString("title"),
            rs.getString("experience"),
            rs.getString("location"),
            rs.getString("apply_link"),
            rs.getString("description"),
            createdAt == null ? null : createdAt.toInstant()
        );
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcJobStore(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public List<JobRecord> findBySourceLink(String sourceLink, int limit) {
        if (sourceLink == null || sourceLink.isBlank()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceLink", sourceLink.trim())
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id,
                       source_link,
                       date_posted,
                       company,
                       job_title,
                       title,
                       experience,
                       location,
                       apply_link,
                       description,
                       created_at
                FROM job_records
                WHERE source_link = :sourceLink
                ORDER BY id ASC
                LIMIT :limit
                """,
            params,
            JOB_RECORD_MAPPER
        );
    }

    @Override
    public long insert(ScrapedJob job) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceLink", job.sourceLink())
            .addValue("datePosted", job.datePosted())
            .addValue("company", job.company())
            .addValue("jobTitle", job.jobTitle())
            .addValue("title", job.displayTitle())
            .addValue("experience", job.experience())
            .addValue("location", job.location())
            .addValue("applyLink", job.applyLink())
            .addValue("description", job.description())
            .addValue("createdAt", Timestamp.from(Instant.now(clock)));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_records (
                    source_link,
                    date_posted,
                    company,
                    job_title,
                    title,
                    experience,
                    location,
                    apply_link,
                    description,
                    created_at
                )
                VALUES (
                    :sourceLink,
                    :datePosted,
                    :company,
                    :jobTitle,
                    :title,
                    :experience,
                    :location,
                    :applyLink,
                    :description,
                    :createdAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert job record for " + job.sourceLink());
        }
        return key.longValue();
    }

    @Override
    public boolean deleteById(long id) {
        int removed = jdbc.update(
            """
                DELETE FROM job_records
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id)
        );
        return removed > 0;
    }

    @Override
    public List<JobRecordRef> findRecordRefs(long afterId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("afterId", Math.max(0L, afterId))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id,
                       source_link,
                       date_posted
                FROM job_records
                WHERE id > :afterId
                ORDER BY id ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> new JobRecordRef(
                rs.getLong("id"),
                rs.getString("source_link"),
                rs.getString("date_posted")
            )
        );
    }

    @Override
    public long countRecords() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM job_records", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public boolean isReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }
}
