package com.dcruver.ideatree.domain;

import lombok.Value;

/**
 * One structural change made to the tree.
 */
@Value
public class TreeChange {

    public enum Type {
        GROUP_CREATED,
        GROUP_RENAMED,
        GROUP_REMOVED,
        SUBGROUP_CREATED,
        SUBGROUP_REMOVED,
        IDEA_ADDED,
        IDEA_REMOVED
    }

    Type type;
    String group;
    String subgroup;
    /** Idea text, or the previous name for a rename. */
    String detail;

    public static TreeChange of(Type type, String group) {
        return new TreeChange(type, group, null, null);
    }

    public static TreeChange of(Type type, String group, String subgroup, String detail) {
        return new TreeChange(type, group, subgroup, detail);
    }

    public String describe() {
        String target = subgroup == null ? group : group + " / " + subgroup;
        return switch (type) {
            case GROUP_CREATED -> "+ group " + group;
            case GROUP_RENAMED -> "~ group " + detail + " -> " + group;
            case GROUP_REMOVED -> "- group " + group;
            case SUBGROUP_CREATED -> "+ subgroup " + target;
            case SUBGROUP_REMOVED -> "- subgroup " + target;
            case IDEA_ADDED -> "+ idea '" + detail + "' in " + target;
            case IDEA_REMOVED -> "- idea '" + detail + "' from " + target;
        };
    }
}
