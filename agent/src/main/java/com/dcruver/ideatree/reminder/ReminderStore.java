package com.dcruver.ideatree.reminder;

import com.dcruver.ideatree.domain.ScheduledReminder;
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

/**
 * Stores scheduled reminders in SQLite.
 *
 * Times are local date-times written as {@code yyyy-MM-dd'T'HH:mm:ss} so that
 * text comparison orders them chronologically.
 */
@Component
@Slf4j
public class ReminderStore {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ReminderStore(DataSource dataSource, Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS reminders (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                message TEXT NOT NULL,
                fire_at TEXT NOT NULL,
                sent INTEGER NOT NULL DEFAULT 0,
                created_at TEXT NOT NULL,
                sent_at TEXT
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_reminders_due
            ON reminders(sent, fire_at)
            """);

        log.info("Initialized reminder store");
    }

    /**
     * Persist a new reminder and return it with its id.
     */
    public ScheduledReminder save(ScheduledReminder reminder) {
        LocalDateTime createdAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO reminders (message, fire_at, sent, created_at) VALUES (?, ?, 0, ?)",
                Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, reminder.getMessage());
            ps.setString(2, format(reminder.getFireAt()));
            ps.setString(3, format(createdAt));
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        ScheduledReminder saved = reminder
            .withId(key == null ? null : key.longValue())
            .withCreatedAt(createdAt)
            .withSent(false);
        log.debug("Stored reminder {} for {}", saved.getId(), saved.getFireAt());
        return saved;
    }

    /**
     * Unsent reminders whose fire time is at or before {@code now}, oldest first.
     */
    public List<ScheduledReminder> findDue(LocalDateTime now) {
        return jdbcTemplate.query(
            "SELECT * FROM reminders WHERE sent = 0 AND fire_at <= ? ORDER BY fire_at, id",
            new ReminderRowMapper(),
            format(now)
        );
    }

    public List<ScheduledReminder> findUnsent() {
        return jdbcTemplate.query(
            "SELECT * FROM reminders WHERE sent = 0 ORDER BY fire_at, id",
            new ReminderRowMapper()
        );
    }

    /**
     * Claim a reminder for delivery. Returns false when another dispatcher already did.
     */
    public boolean markSent(long id) {
        int updated = jdbcTemplate.update(
            "UPDATE reminders SET sent = 1, sent_at = ? WHERE id = ? AND sent = 0",
            format(LocalDateTime.now(clock)), id
        );
        return updated == 1;
    }

    private static String format(LocalDateTime time) {
        return time.truncatedTo(ChronoUnit.SECONDS).format(TIMESTAMP);
    }

    private static class ReminderRowMapper implements RowMapper<ScheduledReminder> {
        @Override
        public ScheduledReminder mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ScheduledReminder.builder()
                .id(rs.getLong("id"))
                .message(rs.getString("message"))
                .fireAt(LocalDateTime.parse(rs.getString("fire_at"), TIMESTAMP))
                .sent(rs.getInt("sent") == 1)
                .createdAt(LocalDateTime.parse(rs.getString("created_at"), TIMESTAMP))
                .build();
        }
    }
}
