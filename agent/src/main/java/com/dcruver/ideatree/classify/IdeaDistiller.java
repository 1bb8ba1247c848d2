package com.dcruver.ideatree.classify;

import com.dcruver.ideatree.domain.IdeaMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces a proposed idea to its core: a handful of words, never a copy of the note
 * and never a leftover "create the group" command.
 */
@Slf4j
public class IdeaDistiller {

    static final double LITERAL_OVERLAP_RATIO = 0.65;
    static final int MEANINGFUL_TOKENS = 4;
    static final int MAX_WORDS = 5;

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    private final LanguageRules rules;
    private final List<Pattern> creationPatterns = new ArrayList<>();

    public IdeaDistiller(LanguageRules rules) {
        this.rules = rules;
        for (String keyword : rules.getCreationKeywords()) {
            creationPatterns.add(LanguageRules.pattern("\\b" + Pattern.quote(keyword) + "\\b"));
        }
    }

    /**
     * @return the distilled idea, or null when nothing worth keeping remains
     */
    public String distill(String idea, String note) {
        if (idea == null || idea.isBlank()) {
            return null;
        }
        String trimmed = rules.getLeadingFiller().matcher(idea.strip()).replaceFirst("").strip();
        if (trimmed.isEmpty()) {
            return null;
        }

        String result = trimmed;
        String[] words = trimmed.split("\\s+");
        List<String> meaningful = meaningfulTokens(trimmed, MEANINGFUL_TOKENS);
        if (words.length > MEANINGFUL_TOKENS && note != null && !meaningful.isEmpty() && isLiteral(trimmed, note)) {
            result = String.join(" ", meaningful);
            log.debug("Idea '{}' too close to note, reduced to '{}'", idea, result);
        } else if (words.length > MAX_WORDS) {
            result = String.join(" ", List.of(words).subList(0, MAX_WORDS));
        }

        if (isCreationCommand(result)) {
            log.debug("Dropping idea '{}': creation command", result);
            return null;
        }
        if (note != null && IdeaMatcher.normalize(result).equals(IdeaMatcher.normalize(note))) {
            log.debug("Dropping idea '{}': same text as the note", result);
            return null;
        }
        return result.isBlank() ? null : result;
    }

    boolean isLiteral(String idea, String note) {
        Set<String> noteTokens = new HashSet<>();
        for (String token : tokens(note)) {
            String lower = token.toLowerCase(rules.getLocale());
            if (!rules.getStopWords().contains(lower)) {
                noteTokens.add(lower);
            }
        }
        if (noteTokens.isEmpty()) {
            return false;
        }
        List<String> ideaTokens = new ArrayList<>();
        for (String token : tokens(idea)) {
            String lower = token.toLowerCase(rules.getLocale());
            if (!rules.getStopWords().contains(lower)) {
                ideaTokens.add(lower);
            }
        }
        Set<String> shared = new HashSet<>(ideaTokens);
        shared.retainAll(noteTokens);
        return (double) shared.size() / Math.max(ideaTokens.size(), 1) >= LITERAL_OVERLAP_RATIO;
    }

    boolean isCreationCommand(String idea) {
        String lower = idea.toLowerCase(rules.getLocale());
        for (Pattern pattern : creationPatterns) {
            if (pattern.matcher(lower).find()) {
                return true;
            }
        }
        List<String> words = List.of(lower.split("\\s+"));
        for (String word : words.subList(0, Math.min(MEANINGFUL_TOKENS, words.size()))) {
            if (rules.getStructuralNouns().contains(word)) {
                return true;
            }
        }
        return rules.getCommandVerb().matcher(lower.strip()).find();
    }

    /**
     * First meaningful tokens in their original casing.
     */
    private List<String> meaningfulTokens(String text, int limit) {
        List<String> kept = new ArrayList<>();
        for (String token : tokens(text)) {
            if (!rules.getStopWords().contains(token.toLowerCase(rules.getLocale()))) {
                kept.add(token);
                if (kept.size() == limit) {
                    break;
                }
            }
        }
        return kept;
    }

    private static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
