package com.dcruver.ideatree.classify;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ClassificationProposal;
import com.dcruver.ideatree.domain.IdeaTree;
import com.dcruver.ideatree.nlp.ClassificationOracle;
import com.dcruver.ideatree.nlp.ProposalReader;
import com.dcruver.ideatree.nlp.RawProposal;
import com.dcruver.ideatree.nlp.StructuredResponseDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classification pipeline for a single note: reminder pre-detection, then the
 * model, decoding, normalization, enumeration splitting and idea distillation.
 *
 * Never touches the tree. Oracle and decode failures propagate to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NoteClassifier {

    private final LanguageRules rules;
    private final ReminderPreDetector reminderPreDetector;
    private final ClassificationOracle oracle;
    private final StructuredResponseDecoder decoder;
    private final ProposalReader proposalReader;
    private final ClassificationNormalizer normalizer;
    private final EnumerationSplitter splitter;
    private final Clock clock;

    public List<CanonicalMutation> classify(String note, IdeaTree tree) {
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<CanonicalMutation> reminder = reminderPreDetector.detect(note, now);
        if (reminder.isPresent()) {
            return List.of(reminder.get());
        }

        RawProposal raw = oracle.classify(note, tree, rules.getLocale());
        List<ClassificationProposal> proposals = new ArrayList<>();
        if (raw.getKind() == RawProposal.Kind.TOOL_CALLS) {
            for (String arguments : raw.getToolArguments()) {
                proposals.addAll(proposalReader.read(decoder.decode(arguments)));
            }
        } else {
            proposals.addAll(proposalReader.read(decoder.decode(raw.getText())));
        }
        log.debug("Model proposed {} classification(s) for '{}'", proposals.size(), note);

        List<CanonicalMutation> batch = normalizer.normalizeBatch(proposals, tree, note);
        batch = normalizer.distillIdeas(splitter.split(batch, note), note);

        List<CanonicalMutation> result = new ArrayList<>(batch.size());
        for (CanonicalMutation mutation : batch) {
            if (mutation.getAction() == Action.REMIND && mutation.isMakesSense() && mutation.getRemindAt() == null) {
                LocalDateTime fireAt = now.truncatedTo(ChronoUnit.SECONDS).plus(reminderPreDetector.getFallbackDelay());
                mutation = mutation.withRemindAt(fireAt);
            }
            result.add(mutation);
        }
        return result;
    }
}
