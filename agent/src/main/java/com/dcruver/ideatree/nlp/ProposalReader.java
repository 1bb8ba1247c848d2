package com.dcruver.ideatree.nlp;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.ClassificationProposal;
import com.dcruver.ideatree.domain.GroupRename;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps decoded model output onto {@link ClassificationProposal}s.
 *
 * Accepts both the snake_case keys the prompts ask for and the camelCase keys some
 * models answer with. Array elements that are not objects are skipped.
 */
@Component
@Slf4j
public class ProposalReader {

    public List<ClassificationProposal> read(JsonNode node) {
        List<ClassificationProposal> proposals = new ArrayList<>();
        if (node == null) {
            return proposals;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isObject()) {
                    proposals.add(readOne(item));
                } else {
                    log.debug("Skipping non-object proposal element: {}", item);
                }
            }
        } else if (node.isObject()) {
            proposals.add(readOne(node));
        }
        return proposals;
    }

    ClassificationProposal readOne(JsonNode node) {
        return ClassificationProposal.builder()
            .action(Action.fromWire(text(node, "action")))
            .makesSense(bool(node, true, "makes_sense", "makesSense"))
            .reason(text(node, "reason"))
            .group(text(node, "group", "project"))
            .subgroup(text(node, "subgroup", "subproject"))
            .idea(text(node, "idea"))
            .newGroup(bool(node, false, "is_new_group", "isNewGroup"))
            .newSubgroup(bool(node, false, "is_new_subgroup", "isNewSubgroup"))
            .inheritParentIdeas(bool(node, false, "inherit_parent_ideas", "inheritParentIdeas"))
            .rename(rename(node))
            .remindAt(dateTime(text(node, "remind_at", "remindAt")))
            .build();
    }

    private GroupRename rename(JsonNode node) {
        JsonNode rename = field(node, "rename_group", "rename");
        if (rename == null || !rename.isObject()) {
            return null;
        }
        String oldName = text(rename, "old_name", "oldName", "from");
        String newName = text(rename, "new_name", "newName", "to");
        if (oldName == null && newName == null) {
            return null;
        }
        return new GroupRename(oldName, newName);
    }

    private static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Text value of the first present key; blank strings and the literal "null" read as absent.
     */
    private static String text(JsonNode node, String... names) {
        JsonNode value = field(node, names);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().strip();
        if (text.isEmpty() || text.equalsIgnoreCase("null") || text.equalsIgnoreCase("none")) {
            return null;
        }
        return text;
    }

    private static boolean bool(JsonNode node, boolean defaultValue, String... names) {
        JsonNode value = field(node, names);
        if (value == null) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.intValue() != 0;
        }
        return switch (value.asText().strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "si", "sí", "1" -> true;
            case "false", "no", "0" -> false;
            default -> defaultValue;
        };
    }

    private static LocalDateTime dateTime(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toLocalDateTime();
            } catch (DateTimeParseException ignored) {
                log.debug("Ignoring unparseable remind_at value: {}", value);
                return null;
            }
        }
    }
}
