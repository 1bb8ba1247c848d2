package com.dcruver.ideatree.service;

import com.dcruver.ideatree.classify.NoteClassifier;
import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ChangeSet;
import com.dcruver.ideatree.domain.IdeaTree;
import com.dcruver.ideatree.domain.ScheduledReminder;
import com.dcruver.ideatree.nlp.DecodeException;
import com.dcruver.ideatree.nlp.OracleUnavailableException;
import com.dcruver.ideatree.reminder.ReminderScheduler;
import com.dcruver.ideatree.tree.TreeOutlineRenderer;
import com.dcruver.ideatree.tree.TreeReconciler;
import com.dcruver.ideatree.tree.TreeRepository;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for notes: classify against the stored tree, apply the batch and
 * schedule any reminders it produced.
 *
 * When the model is unavailable the note goes to the pending inbox instead.
 * Decode failures are not retried here and reach the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteIngestionService {

    private final NoteClassifier classifier;
    private final TreeRepository repository;
    private final TreeReconciler reconciler;
    private final TreeOutlineRenderer renderer;
    private final ReminderScheduler reminderScheduler;
    private final PendingNoteStore pendingNotes;

    public IngestionResult ingest(String note) {
        try {
            return classifyAndApply(note);
        } catch (OracleUnavailableException e) {
            long pendingId = pendingNotes.add(note, e.getMessage());
            return IngestionResult.builder()
                .status(IngestionResult.Status.PENDING)
                .note(note)
                .pendingId(pendingId)
                .message(e.getMessage())
                .build();
        }
    }

    /**
     * Classify and reconcile against a copy of the tree without persisting anything.
     */
    public Preview preview(String note) {
        IdeaTree before = repository.loadTree();
        List<CanonicalMutation> mutations = classifier.classify(note, before);
        TreeReconciler.Reconciliation result = reconciler.apply(before, mutations);
        return Preview.builder()
            .mutations(mutations)
            .changes(result.getChanges())
            .diff(renderer.diff(before, result.getTree()))
            .build();
    }

    /**
     * Re-ingest every pending note, oldest first. Stops at the first note the
     * model is still unavailable for.
     */
    public List<IngestionResult> retryPending() {
        List<IngestionResult> results = new ArrayList<>();
        for (PendingNote pending : pendingNotes.findPending()) {
            try {
                IngestionResult result = classifyAndApply(pending.getText());
                pendingNotes.markProcessed(pending.getId());
                results.add(result);
            } catch (OracleUnavailableException e) {
                pendingNotes.updateReason(pending.getId(), e.getMessage());
                log.warn("Model still unavailable, leaving {} note(s) pending", pendingNotes.findPending().size());
                break;
            } catch (DecodeException e) {
                pendingNotes.updateReason(pending.getId(), e.getMessage());
                log.warn("Pending note #{} still undecodable: {}", pending.getId(), e.getMessage());
            }
        }
        log.info("Retried pending notes, {} processed", results.size());
        return results;
    }

    private IngestionResult classifyAndApply(String note) {
        IdeaTree tree = repository.loadTree();
        List<CanonicalMutation> mutations = classifier.classify(note, tree);

        boolean classifiable = mutations.stream().anyMatch(CanonicalMutation::isMakesSense);
        if (!classifiable) {
            String reason = mutations.isEmpty() ? null : mutations.get(0).getReason();
            log.info("Note not classifiable: {}", reason);
            return IngestionResult.builder()
                .status(IngestionResult.Status.UNCLASSIFIABLE)
                .note(note)
                .mutations(mutations)
                .message(reason)
                .build();
        }

        ChangeSet changes = repository.applyBatch(mutations, reminderScheduler::schedule);
        List<ScheduledReminder> reminders = List.copyOf(changes.getReminders());
        log.info("Applied note: {} change(s), {} conflict(s), {} reminder(s)",
            changes.getChanges().size(), changes.getConflicts().size(), reminders.size());

        return IngestionResult.builder()
            .status(IngestionResult.Status.APPLIED)
            .note(note)
            .mutations(mutations)
            .changes(changes)
            .reminders(reminders)
            .build();
    }

    @Value
    @Builder
    public static class Preview {
        List<CanonicalMutation> mutations;
        ChangeSet changes;
        String diff;
    }
}
