package com.dcruver.ideatree.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalMutationTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void testJsonShape() throws Exception {
        CanonicalMutation mutation = CanonicalMutation.builder()
            .action(Action.ADD)
            .makesSense(true)
            .group("web")
            .idea("logo")
            .newGroup(true)
            .rename(new GroupRename("pagina", "web antigua"))
            .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(mutation));

        assertEquals("add", json.get("action").asText());
        assertTrue(json.get("makesSense").asBoolean());
        assertTrue(json.get("isNewGroup").asBoolean());
        assertFalse(json.get("isNewSubgroup").asBoolean());
        assertEquals("pagina", json.get("rename").get("oldName").asText());
        assertFalse(json.get("rename").has("usable"));
        assertFalse(json.has("subgroup"));
    }

    @Test
    void testReminderJson() throws Exception {
        CanonicalMutation reminder = CanonicalMutation.reminder("llamar", LocalDateTime.of(2026, 3, 1, 9, 0));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(reminder));

        assertEquals("remind", json.get("action").asText());
        assertEquals("2026-03-01T09:00:00", json.get("remindAt").asText());
    }

    @Test
    void testWithoutStructuralFlags() {
        CanonicalMutation first = CanonicalMutation.builder()
            .action(Action.ADD)
            .makesSense(true)
            .group("web")
            .idea("logo")
            .newGroup(true)
            .newSubgroup(true)
            .inheritParentIdeas(true)
            .rename(new GroupRename("a", "b"))
            .build();

        CanonicalMutation rest = first.withoutStructuralFlags();

        assertEquals("web", rest.getGroup());
        assertEquals("logo", rest.getIdea());
        assertFalse(rest.isNewGroup());
        assertFalse(rest.isNewSubgroup());
        assertFalse(rest.isInheritParentIdeas());
        assertNull(rest.getRename());
    }
}
