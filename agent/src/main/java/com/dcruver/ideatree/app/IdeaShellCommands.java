package com.dcruver.ideatree.app;

import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ChangeSet;
import com.dcruver.ideatree.domain.ScheduledReminder;
import com.dcruver.ideatree.domain.TreeChange;
import com.dcruver.ideatree.nlp.DecodeException;
import com.dcruver.ideatree.reminder.ReminderStore;
import com.dcruver.ideatree.service.GroupSummaryService;
import com.dcruver.ideatree.service.IngestionResult;
import com.dcruver.ideatree.service.NoteIngestionService;
import com.dcruver.ideatree.service.PendingNote;
import com.dcruver.ideatree.service.PendingNoteStore;
import com.dcruver.ideatree.tree.TreeOutlineRenderer;
import com.dcruver.ideatree.tree.TreeRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.List;

/**
 * Spring Shell commands for filing notes and inspecting the tree.
 */
@ShellComponent
@Slf4j
public class IdeaShellCommands {

    private final NoteIngestionService ingestionService;
    private final GroupSummaryService summaryService;
    private final TreeRepository repository;
    private final TreeOutlineRenderer renderer;
    private final ReminderStore reminderStore;
    private final PendingNoteStore pendingNotes;
    private final ObjectMapper objectMapper;

    public IdeaShellCommands(NoteIngestionService ingestionService,
                             GroupSummaryService summaryService,
                             TreeRepository repository,
                             TreeOutlineRenderer renderer,
                             ReminderStore reminderStore,
                             PendingNoteStore pendingNotes) {
        this.ingestionService = ingestionService;
        this.summaryService = summaryService;
        this.repository = repository;
        this.renderer = renderer;
        this.reminderStore = reminderStore;
        this.pendingNotes = pendingNotes;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @ShellMethod(key = "note", value = "Classify a note and file it into the tree")
    public String note(@ShellOption(arity = Integer.MAX_VALUE) String[] words) {
        String text = String.join(" ", words);
        log.info("Ingesting note: {}", text);

        try {
            IngestionResult result = ingestionService.ingest(text);
            StringBuilder sb = new StringBuilder();

            switch (result.getStatus()) {
                case PENDING -> {
                    sb.append("Model unavailable, note stored as pending #").append(result.getPendingId()).append('\n');
                    sb.append("Reason: ").append(result.getMessage()).append('\n');
                    sb.append("Run 'retry-pending' once the model is back.\n");
                }
                case UNCLASSIFIABLE -> {
                    sb.append("Note not filed: ").append(result.getMessage()).append('\n');
                }
                case APPLIED -> {
                    appendMutations(sb, result.getMutations());
                    appendChanges(sb, result.getChanges());
                    for (ScheduledReminder reminder : result.getReminders()) {
                        sb.append(String.format("Reminder #%d at %s: %s\n",
                            reminder.getId(), reminder.getFireAt(), reminder.getMessage()));
                    }
                }
            }
            return sb.toString();

        } catch (DecodeException e) {
            log.error("Could not decode model response", e);
            return "Note failed: " + e.getMessage() + "\nRaw response:\n" + e.getRawText();
        } catch (Exception e) {
            log.error("Note failed", e);
            return "Note failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "preview", value = "Show how a note would change the tree, without saving")
    public String preview(@ShellOption(arity = Integer.MAX_VALUE) String[] words) {
        String text = String.join(" ", words);

        try {
            NoteIngestionService.Preview preview = ingestionService.preview(text);
            StringBuilder sb = new StringBuilder();
            appendMutations(sb, preview.getMutations());
            for (String conflict : preview.getChanges().getConflicts()) {
                sb.append("! ").append(conflict).append('\n');
            }
            sb.append('\n');
            sb.append(preview.getDiff().isEmpty() ? "No changes to the tree.\n" : preview.getDiff());
            return sb.toString();

        } catch (Exception e) {
            log.error("Preview failed", e);
            return "Preview failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tree", value = "Print the idea tree")
    public String tree() {
        try {
            return renderer.render(repository.loadTree());
        } catch (Exception e) {
            log.error("Failed to load tree", e);
            return "Tree failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reminders", value = "List reminders that have not fired yet")
    public String reminders() {
        try {
            List<ScheduledReminder> unsent = reminderStore.findUnsent();
            if (unsent.isEmpty()) {
                return "No pending reminders.";
            }
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Pending reminders (%d):\n\n", unsent.size()));
            for (ScheduledReminder reminder : unsent) {
                sb.append(String.format("#%d  %s  %s\n", reminder.getId(), reminder.getFireAt(), reminder.getMessage()));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to list reminders", e);
            return "Reminders failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "pending", value = "List notes stored while the model was unavailable")
    public String pending() {
        try {
            List<PendingNote> notes = pendingNotes.findPending();
            if (notes.isEmpty()) {
                return "No pending notes.";
            }
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Pending notes (%d):\n\n", notes.size()));
            for (PendingNote note : notes) {
                sb.append(String.format("#%d  [%s]  %s\n", note.getId(), note.getCreatedAt(), note.getText()));
                if (note.getReason() != null) {
                    sb.append("     ").append(note.getReason()).append('\n');
                }
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to list pending notes", e);
            return "Pending failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "retry-pending", value = "Classify the notes stored while the model was unavailable")
    public String retryPending() {
        try {
            List<IngestionResult> results = ingestionService.retryPending();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Processed %d pending note(s).\n", results.size()));
            for (IngestionResult result : results) {
                sb.append("\n\"").append(result.getNote()).append("\" → ").append(result.getStatus()).append('\n');
                if (result.getChanges() != null) {
                    appendChanges(sb, result.getChanges());
                }
            }
            int left = pendingNotes.findPending().size();
            if (left > 0) {
                sb.append(String.format("\n%d note(s) still pending.\n", left));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Retry failed", e);
            return "Retry failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "summarize", value = "Summarize the ideas of a group or subgroup")
    public String summarize(
            @ShellOption(help = "Group name") String group,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Subgroup name") String subgroup) {
        try {
            String summary = summaryService.summarize(group, subgroup);
            return summary.isBlank() ? "Nothing to summarize." : summary;
        } catch (Exception e) {
            log.error("Summary failed", e);
            return "Summary failed: " + e.getMessage();
        }
    }

    private void appendMutations(StringBuilder sb, List<CanonicalMutation> mutations) {
        sb.append("Classification:\n");
        for (CanonicalMutation mutation : mutations) {
            try {
                sb.append("  ").append(objectMapper.writeValueAsString(mutation)).append('\n');
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize mutation", e);
                sb.append("  ").append(mutation).append('\n');
            }
        }
    }

    private void appendChanges(StringBuilder sb, ChangeSet changes) {
        if (changes.getChanges().isEmpty() && changes.getConflicts().isEmpty()) {
            sb.append("Tree unchanged.\n");
            return;
        }
        for (TreeChange change : changes.getChanges()) {
            sb.append("✓ ").append(change.describe()).append('\n');
        }
        for (String conflict : changes.getConflicts()) {
            sb.append("! ").append(conflict).append('\n');
        }
    }
}
