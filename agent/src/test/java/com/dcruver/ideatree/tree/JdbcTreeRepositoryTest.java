package com.dcruver.ideatree.tree;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ChangeSet;
import com.dcruver.ideatree.domain.GroupRename;
import com.dcruver.ideatree.domain.IdeaGroup;
import com.dcruver.ideatree.domain.IdeaTree;
import com.dcruver.ideatree.domain.ScheduledReminder;
import com.dcruver.ideatree.reminder.ReminderStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SQLite tree store against a throwaway database file.
 */
class JdbcTreeRepositoryTest {

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private JdbcTreeRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource ds = new DriverManagerDataSource();
        ds.setDriverClassName("org.sqlite.JDBC");
        ds.setUrl("jdbc:sqlite:" + tempDir.resolve("tree.db").toAbsolutePath());
        dataSource = ds;

        repository = new JdbcTreeRepository(dataSource, new TreeReconciler(), new GroupLockRegistry());
        repository.init();
    }

    private static CanonicalMutation add(String group, String subgroup, String idea) {
        return CanonicalMutation.builder()
            .action(Action.ADD)
            .makesSense(true)
            .group(group)
            .subgroup(subgroup)
            .idea(idea)
            .build();
    }

    @Test
    void testEmptyStoreLoadsEmptyTree() {
        assertTrue(repository.loadTree().getGroups().isEmpty());
    }

    @Test
    void testBatchIsPersistedInOrder() {
        repository.applyBatch(List.of(
            add("compras", null, "pan"),
            add("compras", null, "leche"),
            add("compras", "super", "queso"),
            add("películas", null, "Alien")));

        IdeaTree tree = repository.loadTree();

        assertEquals(List.of("compras", "películas"), tree.groupNames());
        IdeaGroup compras = tree.findGroup("compras").orElseThrow();
        assertEquals(List.of("pan", "leche"), compras.getIdeas());
        assertEquals(List.of("queso"), compras.findSubgroup("super").orElseThrow().getIdeas());
    }

    @Test
    void testUntouchedGroupsKeepTheirContent() {
        repository.applyBatch(List.of(add("compras", null, "pan"), add("viajes", null, "Roma")));

        ChangeSet changes = repository.applyBatch(List.of(add("viajes", null, "Lisboa")));

        assertEquals(List.of("viajes"), List.copyOf(changes.touchedGroups()));
        IdeaTree tree = repository.loadTree();
        assertEquals(List.of("pan"), tree.findGroup("compras").orElseThrow().getIdeas());
        assertEquals(List.of("Roma", "Lisboa"), tree.findGroup("viajes").orElseThrow().getIdeas());
    }

    @Test
    void testRenamedGroupKeepsPosition() {
        repository.applyBatch(List.of(add("a", null, "1"), add("b", null, "2"), add("c", null, "3")));

        CanonicalMutation rename = add("d", null, "4")
            .withNewGroup(true)
            .withRename(new GroupRename("b", "bb"));
        repository.applyBatch(List.of(rename));

        IdeaTree tree = repository.loadTree();
        assertEquals(List.of("a", "bb", "c", "d"), tree.groupNames());
        assertEquals(List.of("2"), tree.findGroup("bb").orElseThrow().getIdeas());
    }

    @Test
    void testDeletedGroupIsRemoved() {
        repository.applyBatch(List.of(add("compras", "super", "pan"), add("viajes", null, "Roma")));

        repository.applyBatch(List.of(CanonicalMutation.builder()
            .action(Action.DELETE)
            .makesSense(true)
            .group("compras")
            .build()));

        assertEquals(List.of("viajes"), repository.loadTree().groupNames());
    }

    @Test
    void testFailedBatchIsRolledBack() {
        repository.applyBatch(List.of(add("compras", null, "pan")));

        JdbcTreeRepository failing = new JdbcTreeRepository(dataSource, new TreeReconciler(), new GroupLockRegistry()) {
            @Override
            protected void writeGroup(IdeaGroup group, int position) {
                if (group.getName().equals("roto")) {
                    throw new IllegalStateException("disk full");
                }
                super.writeGroup(group, position);
            }
        };

        assertThrows(IllegalStateException.class, () -> failing.applyBatch(List.of(
            add("compras", null, "leche"),
            add("roto", null, "algo"))));

        IdeaTree tree = repository.loadTree();
        assertEquals(List.of("compras"), tree.groupNames());
        assertEquals(List.of("pan"), tree.findGroup("compras").orElseThrow().getIdeas());
    }

    private ReminderStore reminderStore() {
        ReminderStore store = new ReminderStore(dataSource, Clock.fixed(Instant.parse("2026-02-28T10:00:00Z"), ZoneOffset.UTC));
        store.init();
        return store;
    }

    private static List<CanonicalMutation> mixedBatch() {
        return List.of(
            add("compras", null, "leche"),
            CanonicalMutation.reminder("llamar al dentista", LocalDateTime.of(2026, 3, 1, 9, 0)));
    }

    @Test
    void testRemindersSavedWithTheBatch() {
        ReminderStore reminders = reminderStore();

        ChangeSet changes = repository.applyBatch(mixedBatch(), reminders::save);

        assertEquals(1, changes.getReminders().size());
        assertNotNull(changes.getReminders().get(0).getId());
        assertEquals(List.of("llamar al dentista"),
            reminders.findUnsent().stream().map(ScheduledReminder::getMessage).toList());
        assertEquals(List.of("leche"), repository.loadTree().findGroup("compras").orElseThrow().getIdeas());
    }

    @Test
    void testReminderFailureRollsBackTreeChanges() {
        ReminderStore reminders = reminderStore();
        repository.applyBatch(List.of(add("compras", null, "pan")));

        assertThrows(IllegalStateException.class, () -> repository.applyBatch(mixedBatch(), reminder -> {
            reminders.save(reminder);
            throw new IllegalStateException("reminder store unavailable");
        }));

        assertEquals(List.of("pan"), repository.loadTree().findGroup("compras").orElseThrow().getIdeas());
        assertTrue(reminders.findUnsent().isEmpty());
    }
}
