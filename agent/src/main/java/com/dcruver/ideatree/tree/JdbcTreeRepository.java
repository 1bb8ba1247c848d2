package com.dcruver.ideatree.tree;

import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ChangeSet;
import com.dcruver.ideatree.domain.IdeaGroup;
import com.dcruver.ideatree.domain.IdeaMatcher;
import com.dcruver.ideatree.domain.IdeaTree;
import com.dcruver.ideatree.domain.ScheduledReminder;
import com.dcruver.ideatree.domain.Subgroup;
import com.dcruver.ideatree.domain.TreeChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Stores the tree in SQLite: one row per group, subgroup and idea.
 *
 * A batch is reconciled and written inside a single transaction while holding the
 * locks of every group it names, together with the reminders it produced. Only the
 * groups the batch touched are rewritten.
 */
@Repository
@Slf4j
public class JdbcTreeRepository implements TreeRepository {

    private static final String ROOT = "";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final TreeReconciler reconciler;
    private final GroupLockRegistry locks;

    public JdbcTreeRepository(DataSource dataSource, TreeReconciler reconciler, GroupLockRegistry locks) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.reconciler = reconciler;
        this.locks = locks;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS idea_groups (
                group_key TEXT PRIMARY KEY,
                name TEXT NOT NULL,
                position INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS idea_subgroups (
                group_key TEXT NOT NULL,
                subgroup_key TEXT NOT NULL,
                name TEXT NOT NULL,
                position INTEGER NOT NULL,
                PRIMARY KEY (group_key, subgroup_key)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ideas (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                group_key TEXT NOT NULL,
                subgroup_key TEXT NOT NULL DEFAULT '',
                text TEXT NOT NULL,
                position INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_ideas_group
            ON ideas(group_key, subgroup_key, position)
            """);

        log.info("Initialized idea tree store");
    }

    @Override
    public IdeaTree loadTree() {
        Map<String, IdeaGroup> groups = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT group_key, name FROM idea_groups ORDER BY position, group_key",
            (RowCallbackHandler) rs -> {
                groups.put(rs.getString("group_key"), new IdeaGroup(rs.getString("name")));
            }
        );

        Map<String, Subgroup> subgroups = new HashMap<>();
        jdbcTemplate.query(
            "SELECT group_key, subgroup_key, name FROM idea_subgroups ORDER BY group_key, position",
            (RowCallbackHandler) rs -> {
                IdeaGroup group = groups.get(rs.getString("group_key"));
                if (group == null) {
                    log.warn("Orphan subgroup row {}", rs.getString("subgroup_key"));
                    return;
                }
                Subgroup subgroup = new Subgroup(rs.getString("name"));
                group.getSubgroups().add(subgroup);
                subgroups.put(subgroupId(rs.getString("group_key"), rs.getString("subgroup_key")), subgroup);
            }
        );

        jdbcTemplate.query(
            "SELECT group_key, subgroup_key, text FROM ideas ORDER BY group_key, subgroup_key, position, id",
            (RowCallbackHandler) rs -> {
                String groupKey = rs.getString("group_key");
                String subgroupKey = rs.getString("subgroup_key");
                if (ROOT.equals(subgroupKey)) {
                    IdeaGroup group = groups.get(groupKey);
                    if (group != null) {
                        group.getIdeas().add(rs.getString("text"));
                    }
                } else {
                    Subgroup subgroup = subgroups.get(subgroupId(groupKey, subgroupKey));
                    if (subgroup != null) {
                        subgroup.getIdeas().add(rs.getString("text"));
                    }
                }
            }
        );

        return new IdeaTree(new ArrayList<>(groups.values()));
    }

    @Override
    public ChangeSet applyBatch(List<CanonicalMutation> batch, UnaryOperator<ScheduledReminder> reminderSink) {
        return locks.withLocks(lockNames(batch), () -> transactionTemplate.execute(status -> {
            TreeReconciler.Reconciliation result = reconciler.apply(loadTree(), batch);
            ChangeSet changes = result.getChanges();
            persist(result.getTree(), changes);
            changes.getReminders().replaceAll(reminderSink);
            return changes;
        }));
    }

    private void persist(IdeaTree tree, ChangeSet changes) {
        Set<String> touched = changes.touchedGroups();
        if (touched.isEmpty()) {
            return;
        }

        Map<String, Integer> positions = new HashMap<>();
        for (String key : touched) {
            List<Integer> found = jdbcTemplate.queryForList(
                "SELECT position FROM idea_groups WHERE group_key = ?", Integer.class, key);
            if (!found.isEmpty()) {
                positions.put(key, found.get(0));
            }
        }
        // a renamed group keeps its place in the ordering
        for (TreeChange change : changes.getChanges()) {
            if (change.getType() == TreeChange.Type.GROUP_RENAMED) {
                Integer previous = positions.remove(IdeaMatcher.key(change.getDetail()));
                if (previous != null) {
                    positions.put(IdeaMatcher.key(change.getGroup()), previous);
                }
            }
        }

        for (String key : touched) {
            jdbcTemplate.update("DELETE FROM ideas WHERE group_key = ?", key);
            jdbcTemplate.update("DELETE FROM idea_subgroups WHERE group_key = ?", key);
            jdbcTemplate.update("DELETE FROM idea_groups WHERE group_key = ?", key);
        }

        for (IdeaGroup group : tree.getGroups()) {
            String key = IdeaMatcher.key(group.getName());
            if (!touched.contains(key)) {
                continue;
            }
            Integer position = positions.get(key);
            if (position == null) {
                position = jdbcTemplate.queryForObject(
                    "SELECT COALESCE(MAX(position), -1) + 1 FROM idea_groups", Integer.class);
            }
            writeGroup(group, position);
        }
        log.debug("Rewrote groups {}", touched);
    }

    protected void writeGroup(IdeaGroup group, int position) {
        String groupKey = IdeaMatcher.key(group.getName());
        jdbcTemplate.update(
            "INSERT INTO idea_groups (group_key, name, position) VALUES (?, ?, ?)",
            groupKey, group.getName(), position
        );
        writeIdeas(groupKey, ROOT, group.getIdeas());

        List<Subgroup> subgroups = group.getSubgroups();
        for (int i = 0; i < subgroups.size(); i++) {
            Subgroup subgroup = subgroups.get(i);
            String subgroupKey = IdeaMatcher.key(subgroup.getName());
            jdbcTemplate.update(
                "INSERT INTO idea_subgroups (group_key, subgroup_key, name, position) VALUES (?, ?, ?, ?)",
                groupKey, subgroupKey, subgroup.getName(), i
            );
            writeIdeas(groupKey, subgroupKey, subgroup.getIdeas());
        }
    }

    private void writeIdeas(String groupKey, String subgroupKey, List<String> ideas) {
        for (int i = 0; i < ideas.size(); i++) {
            jdbcTemplate.update(
                "INSERT INTO ideas (group_key, subgroup_key, text, position) VALUES (?, ?, ?, ?)",
                groupKey, subgroupKey, ideas.get(i), i
            );
        }
    }

    private static List<String> lockNames(List<CanonicalMutation> batch) {
        List<String> names = new ArrayList<>();
        for (CanonicalMutation mutation : batch) {
            names.add(mutation.getGroup());
            if (mutation.getRename() != null) {
                names.add(mutation.getRename().getOldName());
                names.add(mutation.getRename().getNewName());
            }
        }
        return names;
    }

    private static String subgroupId(String groupKey, String subgroupKey) {
        return groupKey + '\u0000' + subgroupKey;
    }
}
