package com.dcruver.ideatree.tree;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ChangeSet;
import com.dcruver.ideatree.domain.GroupRename;
import com.dcruver.ideatree.domain.IdeaGroup;
import com.dcruver.ideatree.domain.IdeaMatcher;
import com.dcruver.ideatree.domain.IdeaTree;
import com.dcruver.ideatree.domain.ScheduledReminder;
import com.dcruver.ideatree.domain.Subgroup;
import com.dcruver.ideatree.domain.TreeChange;
import com.dcruver.ideatree.domain.TreeChange.Type;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Applies canonical mutations to a copy of the tree.
 *
 * Reconciliation never throws for a missing target: it records a conflict and leaves
 * the tree alone. Adding the same batch twice leaves the tree as it was after the
 * first application.
 */
@Component
@Slf4j
public class TreeReconciler {

    @Value
    public static class Reconciliation {
        IdeaTree tree;
        ChangeSet changes;
    }

    public Reconciliation apply(IdeaTree tree, List<CanonicalMutation> batch) {
        IdeaTree working = tree.copy();
        ChangeSet changes = new ChangeSet();
        for (CanonicalMutation mutation : batch) {
            apply(working, mutation, changes);
        }
        log.debug("Reconciled {} mutations: {} changes, {} conflicts",
            batch.size(), changes.getChanges().size(), changes.getConflicts().size());
        return new Reconciliation(working, changes);
    }

    private void apply(IdeaTree tree, CanonicalMutation mutation, ChangeSet changes) {
        if (!mutation.isMakesSense()) {
            return;
        }
        Action action = mutation.getAction();
        switch (action) {
            case ADD -> add(tree, mutation, changes);
            case DELETE -> delete(tree, mutation, changes);
            case REMIND -> remind(mutation, changes);
        }
    }

    private void add(IdeaTree tree, CanonicalMutation mutation, ChangeSet changes) {
        if (mutation.getGroup() == null || mutation.getGroup().isBlank()) {
            changes.conflict("add: no target group for '" + mutation.getIdea() + "'");
            return;
        }
        if (mutation.getRename() != null) {
            rename(tree, mutation.getRename(), changes);
        }

        IdeaGroup group = tree.findGroup(mutation.getGroup()).orElseGet(() -> {
            IdeaGroup created = new IdeaGroup(mutation.getGroup().strip());
            tree.getGroups().add(created);
            changes.record(TreeChange.of(Type.GROUP_CREATED, created.getName()));
            return created;
        });

        String idea = mutation.getIdea();
        if (mutation.getSubgroup() != null) {
            Subgroup subgroup = group.findSubgroup(mutation.getSubgroup()).orElseGet(() -> {
                Subgroup created = new Subgroup(mutation.getSubgroup().strip());
                if (mutation.isInheritParentIdeas()) {
                    // one-time snapshot of the parent's root ideas
                    created.getIdeas().addAll(group.getIdeas());
                }
                group.getSubgroups().add(created);
                changes.record(TreeChange.of(Type.SUBGROUP_CREATED, group.getName(), created.getName(), null));
                return created;
            });
            appendIdea(subgroup.getIdeas(), idea, group.getName(), subgroup.getName(), changes);
        } else {
            appendIdea(group.getIdeas(), idea, group.getName(), null, changes);
        }
    }

    private void rename(IdeaTree tree, GroupRename rename, ChangeSet changes) {
        Optional<IdeaGroup> target = tree.findGroup(rename.getOldName());
        if (target.isEmpty()) {
            changes.conflict("rename: no group named '" + rename.getOldName() + "'");
            return;
        }
        Optional<IdeaGroup> clash = tree.findGroup(rename.getNewName());
        if (clash.isPresent() && clash.get() != target.get()) {
            changes.conflict("rename: group '" + rename.getNewName() + "' already exists");
            return;
        }
        IdeaGroup group = target.get();
        String previous = group.getName();
        group.setName(rename.getNewName().strip());
        changes.record(TreeChange.of(Type.GROUP_RENAMED, group.getName(), null, previous));
    }

    private void appendIdea(List<String> ideas, String idea, String group, String subgroup, ChangeSet changes) {
        if (idea == null || idea.isBlank() || IdeaMatcher.containsMatch(ideas, idea)) {
            return;
        }
        ideas.add(idea.strip());
        changes.record(TreeChange.of(Type.IDEA_ADDED, group, subgroup, idea.strip()));
    }

    private void delete(IdeaTree tree, CanonicalMutation mutation, ChangeSet changes) {
        if (mutation.getGroup() == null) {
            changes.conflict("delete: no target group for '" + mutation.getIdea() + "'");
            return;
        }
        Optional<IdeaGroup> found = tree.findGroup(mutation.getGroup());
        if (found.isEmpty()) {
            changes.conflict("delete: no group named '" + mutation.getGroup() + "'");
            return;
        }
        IdeaGroup group = found.get();
        String idea = mutation.getIdea();
        String subgroupName = mutation.getSubgroup();

        if (idea == null && subgroupName == null) {
            tree.removeGroup(group.getName());
            changes.record(TreeChange.of(Type.GROUP_REMOVED, group.getName()));
            return;
        }

        if (idea == null) {
            Optional<Subgroup> subgroup = group.findSubgroup(subgroupName);
            if (subgroup.isEmpty()) {
                changes.conflict("delete: no subgroup '" + subgroupName + "' in '" + group.getName() + "'");
                return;
            }
            group.removeSubgroup(subgroupName);
            changes.record(TreeChange.of(Type.SUBGROUP_REMOVED, group.getName(), subgroup.get().getName(), null));
            return;
        }

        if (subgroupName != null) {
            Optional<Subgroup> subgroup = group.findSubgroup(subgroupName);
            if (subgroup.isEmpty()) {
                changes.conflict("delete: no subgroup '" + subgroupName + "' in '" + group.getName() + "'");
                return;
            }
            if (removeMatches(subgroup.get().getIdeas(), idea, group.getName(), subgroup.get().getName(), changes) == 0) {
                changes.conflict("delete: no idea like '" + idea + "' in '" + group.getName() + " / " + subgroupName + "'");
            }
            return;
        }

        if (removeMatches(group.getIdeas(), idea, group.getName(), null, changes) > 0) {
            return;
        }
        for (Subgroup subgroup : group.getSubgroups()) {
            if (removeMatches(subgroup.getIdeas(), idea, group.getName(), subgroup.getName(), changes) > 0) {
                return;
            }
        }
        changes.conflict("delete: no idea like '" + idea + "' in '" + group.getName() + "'");
    }

    /**
     * Removes the ideas matching the target. When one of them is an exact match, only
     * exact matches go; otherwise every fuzzy match does.
     */
    private int removeMatches(List<String> ideas, String idea, String group, String subgroup, ChangeSet changes) {
        boolean exactOnly = ideas.stream().anyMatch(existing -> IdeaMatcher.sameText(existing, idea));
        int removed = 0;
        Iterator<String> it = ideas.iterator();
        while (it.hasNext()) {
            String existing = it.next();
            boolean hit = exactOnly ? IdeaMatcher.sameText(existing, idea) : IdeaMatcher.matches(existing, idea);
            if (hit) {
                it.remove();
                removed++;
                changes.record(TreeChange.of(Type.IDEA_REMOVED, group, subgroup, existing));
            }
        }
        return removed;
    }

    private void remind(CanonicalMutation mutation, ChangeSet changes) {
        if (mutation.getRemindAt() == null) {
            changes.conflict("remind: no fire time for '" + mutation.getIdea() + "'");
            return;
        }
        changes.remind(ScheduledReminder.of(mutation.getIdea(), mutation.getRemindAt()));
    }
}
