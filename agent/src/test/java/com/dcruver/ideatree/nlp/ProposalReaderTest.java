package com.dcruver.ideatree.nlp;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.ClassificationProposal;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProposalReaderTest {

    private final ProposalReader reader = new ProposalReader();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private List<ClassificationProposal> read(String json) throws Exception {
        JsonNode node = objectMapper.readTree(json);
        return reader.read(node);
    }

    @Test
    void testReadsSnakeCaseProposal() throws Exception {
        List<ClassificationProposal> proposals = read("""
            {"action": "add", "makes_sense": true, "group": "compras", "subgroup": "super",
             "idea": "pan", "is_new_group": true, "is_new_subgroup": true,
             "inherit_parent_ideas": false, "rename_group": null}
            """);

        assertEquals(1, proposals.size());
        ClassificationProposal p = proposals.get(0);
        assertEquals(Action.ADD, p.getAction());
        assertTrue(p.isMakesSense());
        assertEquals("compras", p.getGroup());
        assertEquals("super", p.getSubgroup());
        assertEquals("pan", p.getIdea());
        assertTrue(p.isNewGroup());
        assertTrue(p.isNewSubgroup());
        assertNull(p.getRename());
    }

    @Test
    void testReadsCamelCaseAndAliases() throws Exception {
        ClassificationProposal p = read("""
            {"action": "ADD", "makesSense": "yes", "project": "web", "subproject": "diseño",
             "idea": "logo", "isNewGroup": 1,
             "rename": {"oldName": "pagina", "newName": "web"}}
            """).get(0);

        assertTrue(p.isMakesSense());
        assertEquals("web", p.getGroup());
        assertEquals("diseño", p.getSubgroup());
        assertTrue(p.isNewGroup());
        assertEquals("pagina", p.getRename().getOldName());
        assertEquals("web", p.getRename().getNewName());
    }

    @Test
    void testTreatsNullLiteralsAsAbsent() throws Exception {
        ClassificationProposal p = read("{\"group\": \"compras\", \"subgroup\": \"null\", \"idea\": \"None\"}").get(0);

        assertNull(p.getSubgroup());
        assertNull(p.getIdea());
    }

    @Test
    void testDefaultsWhenFieldsMissing() throws Exception {
        ClassificationProposal p = read("{\"group\": \"compras\"}").get(0);

        assertEquals(Action.ADD, p.getAction());
        assertTrue(p.isMakesSense());
        assertFalse(p.isNewGroup());
        assertFalse(p.isInheritParentIdeas());
    }

    @Test
    void testUnknownActionReadsAsAdd() throws Exception {
        assertEquals(Action.ADD, read("{\"action\": \"classify\", \"group\": \"x\"}").get(0).getAction());
        assertEquals(Action.DELETE, read("{\"action\": \"eliminar\", \"group\": \"x\"}").get(0).getAction());
    }

    @Test
    void testArraySkipsNonObjects() throws Exception {
        List<ClassificationProposal> proposals = read("[{\"idea\": \"Alien\"}, \"junk\", 3, {\"idea\": \"Terminator\"}]");

        assertEquals(2, proposals.size());
        assertEquals("Terminator", proposals.get(1).getIdea());
    }

    @Test
    void testParsesRemindAt() throws Exception {
        ClassificationProposal local = read("{\"action\": \"remind\", \"remind_at\": \"2026-03-01T09:00:00\"}").get(0);
        ClassificationProposal offset = read("{\"action\": \"remind\", \"remind_at\": \"2026-03-01T09:00:00+01:00\"}").get(0);
        ClassificationProposal bad = read("{\"action\": \"remind\", \"remind_at\": \"tomorrow\"}").get(0);

        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 0), local.getRemindAt());
        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 0), offset.getRemindAt());
        assertNull(bad.getRemindAt());
    }
}
