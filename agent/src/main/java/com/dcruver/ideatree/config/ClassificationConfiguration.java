package com.dcruver.ideatree.config;

import com.dcruver.ideatree.classify.ClassificationNormalizer;
import com.dcruver.ideatree.classify.EnumerationSplitter;
import com.dcruver.ideatree.classify.IdeaDistiller;
import com.dcruver.ideatree.classify.LanguageRules;
import com.dcruver.ideatree.classify.ReminderPreDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Wires the deterministic classification rules for the configured language.
 */
@Configuration
@Slf4j
public class ClassificationConfiguration {

    @Bean
    public LanguageRules languageRules(IdeaTreeProperties properties) {
        LanguageRules rules = LanguageRules.forLanguage(properties.getLanguage());
        log.info("Using '{}' classification rules", rules.getLanguage());
        return rules;
    }

    @Bean
    public Clock clock(IdeaTreeProperties properties) {
        String zone = properties.getZone();
        return zone == null || zone.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(zone));
    }

    @Bean
    public IdeaDistiller ideaDistiller(LanguageRules rules) {
        return new IdeaDistiller(rules);
    }

    @Bean
    public ClassificationNormalizer classificationNormalizer(LanguageRules rules, IdeaDistiller distiller) {
        return new ClassificationNormalizer(rules, distiller);
    }

    @Bean
    public EnumerationSplitter enumerationSplitter(LanguageRules rules) {
        return new EnumerationSplitter(rules);
    }

    @Bean
    public ReminderPreDetector reminderPreDetector(LanguageRules rules, IdeaTreeProperties properties) {
        Duration fallback = Duration.ofMinutes(properties.getReminders().getFallbackDelayMinutes());
        return new ReminderPreDetector(rules, fallback);
    }
}
