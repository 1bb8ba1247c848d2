package com.dcruver.ideatree.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything a batch did to the tree, what it declined to do and why,
 * and the reminders it asked to schedule.
 */
@Data
public class ChangeSet {
    private final List<TreeChange> changes = new ArrayList<>();
    private final List<String> conflicts = new ArrayList<>();
    private final List<ScheduledReminder> reminders = new ArrayList<>();

    public void record(TreeChange change) {
        changes.add(change);
    }

    public void conflict(String description) {
        conflicts.add(description);
    }

    public void remind(ScheduledReminder reminder) {
        reminders.add(reminder);
    }

    public boolean isEmpty() {
        return changes.isEmpty() && reminders.isEmpty();
    }

    /**
     * Names of the groups whose stored content is affected, including both sides of a rename.
     */
    public Set<String> touchedGroups() {
        Set<String> names = new LinkedHashSet<>();
        for (TreeChange change : changes) {
            names.add(IdeaMatcher.key(change.getGroup()));
            if (change.getType() == TreeChange.Type.GROUP_RENAMED) {
                names.add(IdeaMatcher.key(change.getDetail()));
            }
        }
        return names;
    }
}
