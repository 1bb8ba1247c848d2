package com.dcruver.ideatree.tree;

import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ChangeSet;
import com.dcruver.ideatree.domain.IdeaTree;
import com.dcruver.ideatree.domain.ScheduledReminder;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Durable home of the idea tree.
 */
public interface TreeRepository {

    /**
     * Consistent snapshot; never shows half of a batch.
     */
    IdeaTree loadTree();

    /**
     * Reconcile the batch against the current tree and store the result as one unit.
     */
    default ChangeSet applyBatch(List<CanonicalMutation> batch) {
        return applyBatch(batch, UnaryOperator.identity());
    }

    /**
     * Like {@link #applyBatch(List)}, but every reminder the batch produces is passed
     * through {@code reminderSink} inside the same unit of work. The change set holds
     * what the sink returned. A sink failure rolls back the tree changes too.
     */
    ChangeSet applyBatch(List<CanonicalMutation> batch, UnaryOperator<ScheduledReminder> reminderSink);
}
