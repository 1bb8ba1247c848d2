package com.dcruver.ideatree.app;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * One SQLite file holds the idea tree, the reminders and the pending-note inbox.
 *
 * Tree batches and their reminders are written in one transaction, and the reminder
 * poller writes concurrently with note ingestion, so every connection takes the write
 * lock when its transaction begins and waits for a busy lock instead of failing.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    static final int BUSY_TIMEOUT_MS = 10000;

    @Bean
    public DataSource dataSource(@Value("${ideatree.db-path:${user.home}/.ideatree/ideatree.db}") String dbPathSetting)
            throws Exception {
        Path dbPath = resolve(dbPathSetting);
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
        log.info("Idea tree database: {}", dbPath);

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl(jdbcUrl(dbPath));
        return dataSource;
    }

    static Path resolve(String dbPathSetting) {
        return Paths.get(dbPathSetting.replace("${user.home}", System.getProperty("user.home"))).toAbsolutePath();
    }

    static String jdbcUrl(Path dbPath) {
        return "jdbc:sqlite:" + dbPath + "?transaction_mode=IMMEDIATE&busy_timeout=" + BUSY_TIMEOUT_MS;
    }
}
