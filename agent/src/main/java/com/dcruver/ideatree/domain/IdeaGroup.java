package com.dcruver.ideatree.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Top-level category node: root ideas plus ordered subgroups.
 */
@Data
public class IdeaGroup {
    private String name;
    private final List<String> ideas;
    private final List<Subgroup> subgroups;

    public IdeaGroup(String name) {
        this(name, new ArrayList<>(), new ArrayList<>());
    }

    public IdeaGroup(String name, List<String> ideas, List<Subgroup> subgroups) {
        this.name = name;
        this.ideas = new ArrayList<>(ideas);
        this.subgroups = new ArrayList<>(subgroups);
    }

    public Optional<Subgroup> findSubgroup(String subgroupName) {
        return subgroups.stream()
            .filter(s -> IdeaMatcher.sameName(s.getName(), subgroupName))
            .findFirst();
    }

    public boolean removeSubgroup(String subgroupName) {
        return subgroups.removeIf(s -> IdeaMatcher.sameName(s.getName(), subgroupName));
    }

    public IdeaGroup copy() {
        List<Subgroup> copies = new ArrayList<>();
        for (Subgroup subgroup : subgroups) {
            copies.add(subgroup.copy());
        }
        return new IdeaGroup(name, ideas, copies);
    }
}
