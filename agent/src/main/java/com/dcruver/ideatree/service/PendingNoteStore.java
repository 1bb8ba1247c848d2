package com.dcruver.ideatree.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

/**
 * Inbox for notes that could not be classified because the model was down.
 */
@Component
@Slf4j
public class PendingNoteStore {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public PendingNoteStore(DataSource dataSource, Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pending_notes (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                text TEXT NOT NULL,
                reason TEXT,
                status TEXT NOT NULL DEFAULT 'pending',
                created_at TEXT NOT NULL
            )
            """);

        log.info("Initialized pending note store");
    }

    public long add(String text, String reason) {
        String createdAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(TIMESTAMP);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO pending_notes (text, reason, status, created_at) VALUES (?, ?, 'pending', ?)",
                Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, text);
            ps.setString(2, reason);
            ps.setString(3, createdAt);
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        long id = key == null ? -1 : key.longValue();
        log.warn("Stored note #{} as pending: {}", id, reason);
        return id;
    }

    /**
     * Pending notes, oldest first.
     */
    public List<PendingNote> findPending() {
        return jdbcTemplate.query(
            "SELECT * FROM pending_notes WHERE status = 'pending' ORDER BY id",
            new PendingNoteRowMapper()
        );
    }

    public void markProcessed(long id) {
        setStatus(id, PendingNote.Status.PROCESSED);
    }

    public void markDiscarded(long id) {
        setStatus(id, PendingNote.Status.DISCARDED);
    }

    public void updateReason(long id, String reason) {
        jdbcTemplate.update("UPDATE pending_notes SET reason = ? WHERE id = ?", reason, id);
    }

    private void setStatus(long id, PendingNote.Status status) {
        jdbcTemplate.update(
            "UPDATE pending_notes SET status = ? WHERE id = ?",
            status.name().toLowerCase(Locale.ROOT), id
        );
        log.debug("Pending note #{} is now {}", id, status);
    }

    private static class PendingNoteRowMapper implements RowMapper<PendingNote> {
        @Override
        public PendingNote mapRow(ResultSet rs, int rowNum) throws SQLException {
            return PendingNote.builder()
                .id(rs.getLong("id"))
                .text(rs.getString("text"))
                .reason(rs.getString("reason"))
                .status(PendingNote.Status.valueOf(rs.getString("status").toUpperCase(Locale.ROOT)))
                .createdAt(LocalDateTime.parse(rs.getString("created_at"), TIMESTAMP))
                .build();
        }
    }
}
