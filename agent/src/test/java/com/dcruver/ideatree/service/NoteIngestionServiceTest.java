package com.dcruver.ideatree.service;

import com.dcruver.ideatree.classify.ClassificationNormalizer;
import com.dcruver.ideatree.classify.EnumerationSplitter;
import com.dcruver.ideatree.classify.IdeaDistiller;
import com.dcruver.ideatree.classify.LanguageRules;
import com.dcruver.ideatree.classify.NoteClassifier;
import com.dcruver.ideatree.classify.ReminderPreDetector;
import com.dcruver.ideatree.domain.IdeaTree;
import com.dcruver.ideatree.nlp.DecodeException;
import com.dcruver.ideatree.nlp.OracleUnavailableException;
import com.dcruver.ideatree.nlp.ProposalReader;
import com.dcruver.ideatree.nlp.RawProposal;
import com.dcruver.ideatree.nlp.StructuredResponseDecoder;
import com.dcruver.ideatree.reminder.ReminderScheduler;
import com.dcruver.ideatree.reminder.ReminderStore;
import com.dcruver.ideatree.tree.GroupLockRegistry;
import com.dcruver.ideatree.tree.JdbcTreeRepository;
import com.dcruver.ideatree.tree.TreeOutlineRenderer;
import com.dcruver.ideatree.tree.TreeReconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end ingestion against a throwaway SQLite file and a scripted model.
 */
class NoteIngestionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-28T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Supplier<RawProposal> modelAnswer;
    private int modelCalls;
    private JdbcTreeRepository repository;
    private ReminderStore reminderStore;
    private PendingNoteStore pendingNotes;
    private NoteIngestionService service;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource ds = new DriverManagerDataSource();
        ds.setDriverClassName("org.sqlite.JDBC");
        ds.setUrl("jdbc:sqlite:" + tempDir.resolve("ideatree.db").toAbsolutePath());

        TreeReconciler reconciler = new TreeReconciler();
        repository = new JdbcTreeRepository(ds, reconciler, new GroupLockRegistry());
        repository.init();
        reminderStore = new ReminderStore(ds, CLOCK);
        reminderStore.init();
        pendingNotes = new PendingNoteStore(ds, CLOCK);
        pendingNotes.init();

        LanguageRules rules = LanguageRules.spanish();
        NoteClassifier classifier = new NoteClassifier(
            rules,
            new ReminderPreDetector(rules, Duration.ofMinutes(5)),
            (note, tree, locale) -> {
                modelCalls++;
                return modelAnswer.get();
            },
            new StructuredResponseDecoder(),
            new ProposalReader(),
            new ClassificationNormalizer(rules, new IdeaDistiller(rules)),
            new EnumerationSplitter(rules),
            CLOCK);

        service = new NoteIngestionService(classifier, repository, reconciler, new TreeOutlineRenderer(),
            new ReminderScheduler(reminderStore), pendingNotes);
    }

    private void modelAnswers(String json) {
        modelAnswer = () -> RawProposal.text(json);
    }

    private void modelDown() {
        modelAnswer = () -> {
            throw new OracleUnavailableException("Model timed out after 240000 ms");
        };
    }

    @Test
    void testNoteIsFiled() {
        modelAnswers("{\"group\": \"compras\", \"idea\": \"pan, queso y leche\", \"is_new_group\": true}");

        IngestionResult result = service.ingest("comprar pan, queso y leche");

        assertEquals(IngestionResult.Status.APPLIED, result.getStatus());
        assertEquals(3, result.getMutations().size());
        assertEquals(List.of("pan", "queso", "leche"), repository.loadTree().findGroup("compras").orElseThrow().getIdeas());
    }

    @Test
    void testReminderIsScheduledWithoutModel() {
        modelDown();

        IngestionResult result = service.ingest("recuérdame mañana a las 9 llamar al dentista");

        assertEquals(IngestionResult.Status.APPLIED, result.getStatus());
        assertEquals(0, modelCalls);
        assertEquals(1, result.getReminders().size());
        assertNotNull(result.getReminders().get(0).getId());
        assertEquals(LocalDateTime.of(2026, 3, 1, 9, 0), reminderStore.findUnsent().get(0).getFireAt());
        assertTrue(repository.loadTree().getGroups().isEmpty());
    }

    @Test
    void testUnclassifiableNoteLeavesTreeAlone() {
        modelAnswers("{\"makes_sense\": false, \"reason\": \"Texto sin significado\"}");

        IngestionResult result = service.ingest("asdfgh");

        assertEquals(IngestionResult.Status.UNCLASSIFIABLE, result.getStatus());
        assertEquals("Texto sin significado", result.getMessage());
        assertTrue(repository.loadTree().getGroups().isEmpty());
    }

    @Test
    void testModelOutageStoresNoteAsPending() {
        modelDown();

        IngestionResult result = service.ingest("comprar pan");

        assertEquals(IngestionResult.Status.PENDING, result.getStatus());
        assertNotNull(result.getPendingId());
        List<PendingNote> pending = pendingNotes.findPending();
        assertEquals(1, pending.size());
        assertEquals("comprar pan", pending.get(0).getText());
        assertEquals(PendingNote.Status.PENDING, pending.get(0).getStatus());
        assertTrue(repository.loadTree().getGroups().isEmpty());
    }

    @Test
    void testRetryPendingFilesNotesOnceModelIsBack() {
        modelDown();
        service.ingest("comprar pan");
        service.ingest("comprar leche");

        assertTrue(service.retryPending().isEmpty());
        assertEquals(2, pendingNotes.findPending().size());

        modelAnswer = () -> RawProposal.text(modelCalls % 2 == 1
            ? "{\"group\": \"compras\", \"idea\": \"pan\"}"
            : "{\"group\": \"compras\", \"idea\": \"leche\"}");
        modelCalls = 0;

        List<IngestionResult> results = service.retryPending();

        assertEquals(2, results.size());
        assertTrue(pendingNotes.findPending().isEmpty());
        assertEquals(List.of("pan", "leche"), repository.loadTree().findGroup("compras").orElseThrow().getIdeas());
    }

    @Test
    void testDecodeFailureReachesCaller() {
        modelAnswers("lo siento, no puedo");

        assertThrows(DecodeException.class, () -> service.ingest("comprar pan"));
        assertTrue(pendingNotes.findPending().isEmpty());
    }

    @Test
    void testPreviewDoesNotPersist() {
        modelAnswers("{\"group\": \"compras\", \"idea\": \"pan\", \"is_new_group\": true}");

        NoteIngestionService.Preview preview = service.preview("comprar pan");

        assertTrue(preview.getDiff().contains("+* compras"));
        assertTrue(preview.getDiff().contains("+  - pan"));
        IdeaTree tree = repository.loadTree();
        assertTrue(tree.getGroups().isEmpty());
    }
}
