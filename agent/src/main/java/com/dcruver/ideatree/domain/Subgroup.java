package com.dcruver.ideatree.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Second-level node scoping ideas by place or context within a group.
 */
@Data
public class Subgroup {
    private String name;
    private final List<String> ideas;

    public Subgroup(String name) {
        this(name, new ArrayList<>());
    }

    public Subgroup(String name, List<String> ideas) {
        this.name = name;
        this.ideas = new ArrayList<>(ideas);
    }

    public Subgroup copy() {
        return new Subgroup(name, ideas);
    }
}
