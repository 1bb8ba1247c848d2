package com.dcruver.ideatree.tree;

import com.dcruver.ideatree.domain.IdeaGroup;
import com.dcruver.ideatree.domain.IdeaTree;
import com.dcruver.ideatree.domain.Subgroup;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text outline of the tree, and unified diffs between two outlines.
 */
@Component
public class TreeOutlineRenderer {

    public List<String> outline(IdeaTree tree) {
        List<String> lines = new ArrayList<>();
        for (IdeaGroup group : tree.getGroups()) {
            lines.add("* " + group.getName());
            for (String idea : group.getIdeas()) {
                lines.add("  - " + idea);
            }
            for (Subgroup subgroup : group.getSubgroups()) {
                lines.add("  ** " + subgroup.getName());
                for (String idea : subgroup.getIdeas()) {
                    lines.add("     - " + idea);
                }
            }
        }
        return lines;
    }

    public String render(IdeaTree tree) {
        List<String> lines = outline(tree);
        return lines.isEmpty() ? "(empty tree)" : String.join("\n", lines);
    }

    /**
     * Unified diff of the outlines, empty when nothing changed.
     */
    public String diff(IdeaTree before, IdeaTree after) {
        List<String> originalLines = outline(before);
        List<String> revisedLines = outline(after);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "tree/current",
            "tree/proposed",
            originalLines,
            patch,
            3  // context lines
        );

        return String.join("\n", unifiedDiff);
    }
}
