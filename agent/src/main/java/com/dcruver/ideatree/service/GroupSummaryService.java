package com.dcruver.ideatree.service;

import com.dcruver.ideatree.domain.IdeaGroup;
import com.dcruver.ideatree.domain.Subgroup;
import com.dcruver.ideatree.nlp.IdeaChatService;
import com.dcruver.ideatree.tree.TreeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class GroupSummaryService {

    private final TreeRepository repository;
    private final IdeaChatService chatService;

    /**
     * Summarize a group, or one of its subgroups. A group summary covers the ideas of
     * every subgroup as well.
     *
     * @throws IllegalArgumentException when the group or subgroup does not exist
     */
    public String summarize(String groupName, String subgroupName) {
        IdeaGroup group = repository.loadTree().findGroup(groupName)
            .orElseThrow(() -> new IllegalArgumentException("No group named '" + groupName + "'"));

        List<String> ideas = new ArrayList<>();
        String subgroupLabel = null;
        if (subgroupName != null && !subgroupName.isBlank()) {
            Subgroup subgroup = group.findSubgroup(subgroupName)
                .orElseThrow(() -> new IllegalArgumentException(
                    "No subgroup named '" + subgroupName + "' in '" + group.getName() + "'"));
            subgroupLabel = subgroup.getName();
            ideas.addAll(subgroup.getIdeas());
        } else {
            ideas.addAll(group.getIdeas());
            for (Subgroup subgroup : group.getSubgroups()) {
                for (String idea : subgroup.getIdeas()) {
                    ideas.add(subgroup.getName() + ": " + idea);
                }
            }
        }

        if (ideas.isEmpty()) {
            log.debug("Nothing to summarize in '{}'", group.getName());
            return "";
        }
        log.info("Summarizing {} idea(s) in '{}'", ideas.size(), group.getName());
        return chatService.summarize(group.getName(), subgroupLabel, ideas);
    }
}
