package com.dcruver.ideatree.classify;

import com.dcruver.ideatree.domain.Action;
import com.dcruver.ideatree.domain.CanonicalMutation;
import com.dcruver.ideatree.domain.ClassificationProposal;
import com.dcruver.ideatree.domain.GroupRename;
import com.dcruver.ideatree.domain.IdeaGroup;
import com.dcruver.ideatree.domain.IdeaTree;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw model proposals into canonical mutations.
 *
 * The model's answer is corrected with deterministic rules, applied in order:
 * <ol>
 *   <li>makes_sense=false ends evaluation with the model's reason</li>
 *   <li>delete wording in the note forces a delete</li>
 *   <li>deletes keep their target and lose every structural flag</li>
 *   <li>a "new" group whose name the note already mentions reuses the existing group</li>
 *   <li>mandatory category keywords override a free-form group; routine activities pick the subgroup</li>
 *   <li>a rename survives only alongside a new group</li>
 * </ol>
 * Idea text is distilled separately by {@link #distillIdeas}, once enumerations
 * have been split into single items.
 */
@Slf4j
public class ClassificationNormalizer {

    private final LanguageRules rules;
    private final IdeaDistiller distiller;
    private final Map<Pattern, String> routineActivities = new LinkedHashMap<>();

    public ClassificationNormalizer(LanguageRules rules, IdeaDistiller distiller) {
        this.rules = rules;
        this.distiller = distiller;
        rules.getRoutineActivities().forEach((keyword, subgroup) ->
            routineActivities.put(LanguageRules.pattern("\\b" + Pattern.quote(keyword)), subgroup));
    }

    /**
     * Normalize every proposal for one note. Only the first result may keep
     * structural flags or a rename.
     */
    public List<CanonicalMutation> normalizeBatch(List<ClassificationProposal> proposals, IdeaTree tree, String note) {
        if (proposals == null || proposals.isEmpty()) {
            return List.of(CanonicalMutation.unclassifiable(rules.getEmptyResponseReason()));
        }
        List<CanonicalMutation> batch = new ArrayList<>();
        for (ClassificationProposal proposal : proposals) {
            CanonicalMutation mutation = normalize(proposal, tree, note);
            batch.add(batch.isEmpty() ? mutation : mutation.withoutStructuralFlags());
        }
        return batch;
    }

    public CanonicalMutation normalize(ClassificationProposal proposal, IdeaTree tree, String note) {
        if (!proposal.isMakesSense()) {
            String reason = blankToNull(proposal.getReason());
            return CanonicalMutation.unclassifiable(reason != null ? reason : rules.getUnclassifiableReason());
        }

        Action action = proposal.getAction();
        if (action == Action.ADD && isDeleteIntent(note)) {
            log.debug("Delete wording found in note, overriding add");
            action = Action.DELETE;
        }

        return switch (action) {
            case DELETE -> CanonicalMutation.builder()
                .action(Action.DELETE)
                .makesSense(true)
                .group(blankToNull(proposal.getGroup()))
                .subgroup(blankToNull(proposal.getSubgroup()))
                .idea(blankToNull(proposal.getIdea()))
                .build();
            case REMIND -> CanonicalMutation.builder()
                .action(Action.REMIND)
                .makesSense(true)
                .idea(Optional.ofNullable(blankToNull(proposal.getIdea())).orElse(note.strip()))
                .remindAt(proposal.getRemindAt())
                .build();
            case ADD -> normalizeAdd(proposal, tree, note);
        };
    }

    private CanonicalMutation normalizeAdd(ClassificationProposal proposal, IdeaTree tree, String note) {
        String group = blankToNull(proposal.getGroup());
        String subgroup = blankToNull(proposal.getSubgroup());
        boolean newGroup = proposal.isNewGroup();
        boolean newSubgroup = proposal.isNewSubgroup();

        if (newGroup) {
            Optional<String> mentioned = findMentionedGroup(tree, note);
            if (mentioned.isPresent()) {
                log.debug("Note names existing group '{}', not creating '{}'", mentioned.get(), group);
                group = mentioned.get();
                newGroup = false;
            }
        }

        if (!rules.isMandatoryCategory(group)) {
            Optional<String> category = guessCategory(note);
            if (category.isPresent()) {
                log.debug("Category keywords override group '{}' with '{}'", group, category.get());
                group = category.get();
                newGroup = tree.findGroup(group).isEmpty();
                if (group.equals(rules.getRoutineCategory()) && subgroup == null) {
                    Optional<String> activity = routineActivity(note);
                    if (activity.isPresent()) {
                        subgroup = activity.get();
                        newSubgroup = true;
                    }
                }
            }
        }

        if (group == null) {
            return CanonicalMutation.unclassifiable(rules.getMissingGroupReason());
        }

        GroupRename rename = proposal.getRename();
        if (rename != null && (!newGroup || !rename.isUsable())) {
            log.debug("Discarding rename {} (new group: {})", rename, newGroup);
            rename = null;
        }

        return CanonicalMutation.builder()
            .action(Action.ADD)
            .makesSense(true)
            .group(group)
            .subgroup(subgroup)
            .idea(blankToNull(proposal.getIdea()))
            .newGroup(newGroup)
            .newSubgroup(newSubgroup)
            .inheritParentIdeas(proposal.isInheritParentIdeas())
            .rename(rename)
            .build();
    }

    /**
     * Distill the idea of every classifiable add in the batch.
     */
    public List<CanonicalMutation> distillIdeas(List<CanonicalMutation> batch, String note) {
        List<CanonicalMutation> distilled = new ArrayList<>(batch.size());
        for (CanonicalMutation mutation : batch) {
            if (mutation.getAction() == Action.ADD && mutation.isMakesSense()) {
                mutation = mutation.withIdea(distiller.distill(mutation.getIdea(), note));
            }
            distilled.add(mutation);
        }
        return distilled;
    }

    boolean isDeleteIntent(String note) {
        String lower = lower(note);
        return rules.getDeleteKeywords().stream().anyMatch(lower::contains);
    }

    Optional<String> guessCategory(String note) {
        String lower = lower(note);
        for (Map.Entry<String, List<String>> entry : rules.getCategoryKeywords().entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    Optional<String> routineActivity(String note) {
        for (Map.Entry<Pattern, String> entry : routineActivities.entrySet()) {
            if (entry.getKey().matcher(note).find()) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private Optional<String> findMentionedGroup(IdeaTree tree, String note) {
        String lower = lower(note);
        return tree.getGroups().stream()
            .map(IdeaGroup::getName)
            .filter(name -> name != null && !name.isBlank() && lower.contains(lower(name)))
            .findFirst();
    }

    private String lower(String text) {
        return text == null ? "" : text.toLowerCase(rules.getLocale());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
