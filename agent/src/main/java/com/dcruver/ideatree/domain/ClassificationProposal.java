package com.dcruver.ideatree.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One raw classification as proposed by the model, before any correction.
 * Nothing here is trusted.
 */
@Value
@Builder(toBuilder = true)
public class ClassificationProposal {
    @Builder.Default
    Action action = Action.ADD;
    @Builder.Default
    boolean makesSense = true;
    String reason;
    String group;
    String subgroup;
    String idea;
    boolean newGroup;
    boolean newSubgroup;
    boolean inheritParentIdeas;
    GroupRename rename;
    LocalDateTime remindAt;
}
