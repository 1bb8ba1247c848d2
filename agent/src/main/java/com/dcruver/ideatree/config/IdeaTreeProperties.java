package com.dcruver.ideatree.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties under {@code ideatree.*}.
 */
@ConfigurationProperties(prefix = "ideatree")
@Data
public class IdeaTreeProperties {

    /** Note language: {@code es} or {@code en}. */
    private String language = "es";

    /** Zone used to resolve "now" for reminders. Empty means the system zone. */
    private String zone = "";

    private String dbPath = "${user.home}/.ideatree/ideatree.db";

    private Oracle oracle = new Oracle();

    private Reminders reminders = new Reminders();

    public enum OracleMode {
        TEXT,
        TOOL
    }

    @Data
    public static class Oracle {
        private OracleMode mode = OracleMode.TEXT;
        private long timeoutMs = 240000;
        private double temperature = 0.1;
    }

    @Data
    public static class Reminders {
        private long fallbackDelayMinutes = 5;
        private long pollIntervalMs = 30000;
    }
}
