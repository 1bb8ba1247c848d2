package com.dcruver.ideatree;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Idea Tree agent.
 *
 * Files free-text notes into a two-level tree of groups, subgroups and ideas,
 * using a local Ollama model for the first guess and deterministic rules for
 * the final word. Reminder requests are scheduled and delivered by a poller.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Slf4j
public class IdeaTreeApplication {

    public static void main(String[] args) {
        log.info("Starting Idea Tree agent...");
        SpringApplication.run(IdeaTreeApplication.class, args);
    }
}
