package com.dcruver.ideatree.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the whole two-level tree. Passed around as a value; callers that
 * need to change it work on a {@link #copy()}.
 */
@Data
public class IdeaTree {
    private final List<IdeaGroup> groups;

    public IdeaTree() {
        this(new ArrayList<>());
    }

    public IdeaTree(List<IdeaGroup> groups) {
        this.groups = new ArrayList<>(groups);
    }

    public Optional<IdeaGroup> findGroup(String groupName) {
        return groups.stream()
            .filter(g -> IdeaMatcher.sameName(g.getName(), groupName))
            .findFirst();
    }

    public boolean hasGroup(String groupName) {
        return findGroup(groupName).isPresent();
    }

    public boolean removeGroup(String groupName) {
        return groups.removeIf(g -> IdeaMatcher.sameName(g.getName(), groupName));
    }

    public List<String> groupNames() {
        return groups.stream().map(IdeaGroup::getName).toList();
    }

    public IdeaTree copy() {
        List<IdeaGroup> copies = new ArrayList<>();
        for (IdeaGroup group : groups) {
            copies.add(group.copy());
        }
        return new IdeaTree(copies);
    }
}
