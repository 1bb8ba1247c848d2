package com.dcruver.ideatree.classify;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.CanonicalMutation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a single add whose idea is really a list ("bread, cheese and milk")
 * into one add per item.
 */
@Slf4j
public class EnumerationSplitter {

    static final int MAX_IDEA_PART_WORDS = 4;
    static final int MAX_TAIL_ITEM_WORDS = 3;
    static final int MIN_TAIL_ITEMS = 3;

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.!?;:]+$");

    private final LanguageRules rules;

    public EnumerationSplitter(LanguageRules rules) {
        this.rules = rules;
    }

    public List<CanonicalMutation> split(List<CanonicalMutation> batch, String note) {
        if (batch.size() != 1) {
            return batch;
        }
        CanonicalMutation mutation = batch.get(0);
        if (mutation.getAction() != Action.ADD || !mutation.isMakesSense()) {
            return batch;
        }

        Optional<List<String>> items = splitIdea(mutation.getIdea());
        if (items.isEmpty()) {
            items = splitNoteTail(note);
        }
        if (items.isEmpty()) {
            return batch;
        }

        log.debug("Expanding '{}' into {} ideas: {}", mutation.getIdea(), items.get().size(), items.get());
        List<CanonicalMutation> expanded = new ArrayList<>();
        for (String item : items.get()) {
            CanonicalMutation copy = mutation.withIdea(item);
            expanded.add(expanded.isEmpty() ? copy : copy.withoutStructuralFlags());
        }
        return expanded;
    }

    /**
     * The idea itself is a comma/conjunction separated list of short parts.
     */
    Optional<List<String>> splitIdea(String idea) {
        if (idea == null || idea.isBlank()) {
            return Optional.empty();
        }
        List<String> parts = segments(idea);
        if (parts.size() < 2) {
            return Optional.empty();
        }
        for (String part : parts) {
            int words = wordCount(part);
            if (words < 1 || words > MAX_IDEA_PART_WORDS) {
                return Optional.empty();
            }
        }
        return Optional.of(parts);
    }

    /**
     * The note ends with a list of at least three short items, the last of them joined
     * by a conjunction. Walking back from the end, every short segment is an item; the
     * first segment, or any longer one, contributes only its last word and ends the list.
     */
    Optional<List<String>> splitNoteTail(String note) {
        if (note == null || note.isBlank() || !endsWithConjunction(note)) {
            return Optional.empty();
        }
        List<String> segments = segments(note);
        if (segments.size() < MIN_TAIL_ITEMS) {
            return Optional.empty();
        }

        LinkedList<String> items = new LinkedList<>();
        for (int i = segments.size() - 1; i >= 0; i--) {
            String segment = segments.get(i);
            String[] words = segment.split("\\s+");
            boolean leading = i == 0;
            if (!leading && words.length <= MAX_TAIL_ITEM_WORDS) {
                items.addFirst(segment);
                continue;
            }
            items.addFirst(words[words.length - 1]);
            break;
        }
        return items.size() >= MIN_TAIL_ITEMS ? Optional.of(List.copyOf(items)) : Optional.empty();
    }

    private boolean endsWithConjunction(String note) {
        Matcher conjunction = rules.getConjunction().matcher(note);
        int lastEnd = -1;
        while (conjunction.find()) {
            lastEnd = conjunction.end();
        }
        return lastEnd >= 0 && note.indexOf(',', lastEnd) < 0;
    }

    private List<String> segments(String text) {
        String flattened = rules.getConjunction().matcher(text.strip()).replaceAll(",");
        flattened = TRAILING_PUNCTUATION.matcher(flattened).replaceAll("");
        List<String> parts = new ArrayList<>();
        for (String part : flattened.split(",")) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    private static int wordCount(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }
}
