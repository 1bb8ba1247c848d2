package com.dcruver.ideatree.classify;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ClassificationProposal;
import com.dcruver.ideatree.domain.GroupRename;
import com.dcruver.ideatree.domain.IdeaGroup;
import com.dcruver.ideatree.domain.IdeaTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationNormalizerTest {

    private LanguageRules rules;
    private ClassificationNormalizer normalizer;

    @BeforeEach
    void setUp() {
        rules = LanguageRules.spanish();
        normalizer = new ClassificationNormalizer(rules, new IdeaDistiller(rules));
    }

    private static IdeaTree treeWith(String... groups) {
        IdeaTree tree = new IdeaTree();
        for (String group : groups) {
            tree.getGroups().add(new IdeaGroup(group));
        }
        return tree;
    }

    @Test
    void testUnclassifiableKeepsReason() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .makesSense(false)
            .reason("Texto sin significado")
            .group("compras")
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, new IdeaTree(), "asdfgh");

        assertFalse(result.isMakesSense());
        assertEquals("Texto sin significado", result.getReason());
    }

    @Test
    void testUnclassifiableGetsDefaultReason() {
        ClassificationProposal proposal = ClassificationProposal.builder().makesSense(false).build();

        CanonicalMutation result = normalizer.normalize(proposal, new IdeaTree(), "hola");

        assertEquals(rules.getUnclassifiableReason(), result.getReason());
    }

    @Test
    void testDeleteWordingOverridesAdd() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .action(Action.ADD)
            .group("compras")
            .idea("leche")
            .newGroup(true)
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, treeWith("compras"), "ya no quiero leche");

        assertEquals(Action.DELETE, result.getAction());
        assertEquals("compras", result.getGroup());
        assertEquals("leche", result.getIdea());
        assertFalse(result.isNewGroup());
    }

    @Test
    void testDeleteTargetsPassThrough() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .action(Action.DELETE)
            .group("viajes")
            .subgroup("roma")
            .newSubgroup(true)
            .rename(new GroupRename("viajes", "escapadas"))
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, treeWith("viajes"), "borra el subgrupo roma");

        assertEquals(Action.DELETE, result.getAction());
        assertEquals("roma", result.getSubgroup());
        assertNull(result.getIdea());
        assertFalse(result.isNewSubgroup());
        assertNull(result.getRename());
    }

    @Test
    void testMentionedExistingGroupIsReused() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .group("cine")
            .idea("Alien")
            .newGroup(true)
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, treeWith("películas"), "ver Alien, para películas");

        assertEquals("películas", result.getGroup());
        assertFalse(result.isNewGroup());
    }

    @Test
    void testCategoryKeywordsOverrideGroup() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .group("comida")
            .idea("pan")
            .newGroup(true)
            .build();

        CanonicalMutation fresh = normalizer.normalize(proposal, new IdeaTree(), "comprar pan en el super");
        CanonicalMutation existing = normalizer.normalize(proposal, treeWith("compras"), "comprar pan en el super");

        assertEquals("compras", fresh.getGroup());
        assertTrue(fresh.isNewGroup());
        assertEquals("compras", existing.getGroup());
        assertFalse(existing.isNewGroup());
    }

    @Test
    void testRoutineActivityPicksSubgroup() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .group("ejercicio")
            .idea("nadar")
            .newGroup(true)
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, new IdeaTree(), "ir a nadar los martes");

        assertEquals("rutina diaria", result.getGroup());
        assertEquals("deporte", result.getSubgroup());
        assertTrue(result.isNewSubgroup());
    }

    @Test
    void testRenameDroppedWithoutNewGroup() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .group("web")
            .idea("logo")
            .rename(new GroupRename("web", "página web"))
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, treeWith("web"), "logo para la web");

        assertNull(result.getRename());
        assertEquals("logo", result.getIdea());
    }

    @Test
    void testRenameKeptWithNewGroup() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .group("app recetas")
            .newGroup(true)
            .rename(new GroupRename("proyectos", "proyectos antiguos"))
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, treeWith("proyectos"), "una app de recetas");

        assertNotNull(result.getRename());
        assertEquals("proyectos antiguos", result.getRename().getNewName());
        assertNull(result.getIdea());
    }

    @Test
    void testUselessRenameDropped() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .group("app recetas")
            .newGroup(true)
            .rename(new GroupRename("Proyectos", "proyectos"))
            .build();

        assertNull(normalizer.normalize(proposal, treeWith("proyectos"), "una app de recetas").getRename());
    }

    @Test
    void testMissingGroupIsUnclassifiable() {
        ClassificationProposal proposal = ClassificationProposal.builder().idea("algo").build();

        CanonicalMutation result = normalizer.normalize(proposal, new IdeaTree(), "algo");

        assertFalse(result.isMakesSense());
        assertEquals(rules.getMissingGroupReason(), result.getReason());
    }

    @Test
    void testRemindDefaultsIdeaToNote() {
        LocalDateTime at = LocalDateTime.of(2026, 3, 1, 9, 0);
        ClassificationProposal proposal = ClassificationProposal.builder()
            .action(Action.REMIND)
            .remindAt(at)
            .newGroup(true)
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, new IdeaTree(), "llamar a mamá");

        assertEquals(Action.REMIND, result.getAction());
        assertEquals("llamar a mamá", result.getIdea());
        assertEquals(at, result.getRemindAt());
        assertFalse(result.isNewGroup());
    }

    @Test
    void testBatchClearsFlagsAfterFirst() {
        List<ClassificationProposal> proposals = List.of(
            ClassificationProposal.builder().group("películas").idea("Alien").newGroup(true).build(),
            ClassificationProposal.builder().group("películas").idea("Terminator").newGroup(true)
                .newSubgroup(true).inheritParentIdeas(true).build());

        List<CanonicalMutation> batch = normalizer.normalizeBatch(proposals, new IdeaTree(), "ver Alien y Terminator");

        assertEquals(2, batch.size());
        assertTrue(batch.get(0).isNewGroup());
        assertFalse(batch.get(1).isNewGroup());
        assertFalse(batch.get(1).isNewSubgroup());
        assertFalse(batch.get(1).isInheritParentIdeas());
    }

    @Test
    void testNormalizeLeavesIdeaUndistilled() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .group("compras")
            .idea("pan, queso, leche, huevos, harina y sal")
            .build();

        CanonicalMutation result = normalizer.normalize(proposal, treeWith("compras"), "pan, queso, leche, huevos, harina y sal");

        assertEquals("pan, queso, leche, huevos, harina y sal", result.getIdea());
    }

    @Test
    void testDistillIdeasDropsCopyOfNote() {
        ClassificationProposal proposal = ClassificationProposal.builder()
            .group("proyectos")
            .idea("web sobre gatos")
            .build();
        String note = "web sobre gatos";

        List<CanonicalMutation> batch = normalizer.distillIdeas(
            List.of(normalizer.normalize(proposal, treeWith("proyectos"), note)), note);

        assertEquals("proyectos", batch.get(0).getGroup());
        assertNull(batch.get(0).getIdea());
    }

    @Test
    void testDistillIdeasSkipsDeletesAndReminders() {
        CanonicalMutation delete = CanonicalMutation.builder()
            .action(Action.DELETE).makesSense(true).group("compras").idea("leche").build();
        CanonicalMutation reminder = CanonicalMutation.reminder("llamar a mamá", LocalDateTime.of(2026, 3, 1, 9, 0));

        List<CanonicalMutation> batch = normalizer.distillIdeas(List.of(delete, reminder), "leche");

        assertEquals(List.of(delete, reminder), batch);
    }

    @Test
    void testEmptyBatchIsUnclassifiable() {
        List<CanonicalMutation> batch = normalizer.normalizeBatch(List.of(), new IdeaTree(), "hola");

        assertEquals(1, batch.size());
        assertFalse(batch.get(0).isMakesSense());
        assertEquals(rules.getEmptyResponseReason(), batch.get(0).getReason());
    }
}
