package com.dcruver.ideatree.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * Request to rename an existing group when a new group is created.
 */
@Value
public class GroupRename {
    String oldName;
    String newName;

    /**
     * A rename with a blank side or with identical names does nothing useful.
     */
    @JsonIgnore
    public boolean isUsable() {
        return oldName != null && !oldName.isBlank()
            && newName != null && !newName.isBlank()
            && !IdeaMatcher.key(oldName).equals(IdeaMatcher.key(newName));
    }
}
