package com.dcruver.ideatree.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;

/**
 * A corrected, internally consistent instruction for the tree.
 *
 * Structural flags and rename may only be set on the first mutation of a note's batch,
 * and rename is only ever set together with newGroup.
 */
@Value
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CanonicalMutation {
    Action action;
    boolean makesSense;
    String reason;
    String group;
    String subgroup;
    String idea;
    @JsonProperty("isNewGroup")
    boolean newGroup;
    @JsonProperty("isNewSubgroup")
    boolean newSubgroup;
    boolean inheritParentIdeas;
    GroupRename rename;
    LocalDateTime remindAt;

    /**
     * Terminal outcome for a note that does not express anything classifiable.
     */
    public static CanonicalMutation unclassifiable(String reason) {
        return CanonicalMutation.builder()
            .action(Action.ADD)
            .makesSense(false)
            .reason(reason)
            .build();
    }

    public static CanonicalMutation reminder(String message, LocalDateTime fireAt) {
        return CanonicalMutation.builder()
            .action(Action.REMIND)
            .makesSense(true)
            .idea(message)
            .remindAt(fireAt)
            .build();
    }

    /**
     * Same target, but without any of the first-of-batch structural flags.
     */
    public CanonicalMutation withoutStructuralFlags() {
        return toBuilder()
            .newGroup(false)
            .newSubgroup(false)
            .inheritParentIdeas(false)
            .rename(null)
            .build();
    }
}
