package com.dcruver.ideatree.nlp;

import com.dcruver.ideatree.domain.IdeaTree;

import java.util.Locale;

/**
 * Language model that proposes a classification for a note given the current tree.
 */
public interface ClassificationOracle {

    /**
     * @throws OracleUnavailableException when the model cannot be reached or does not answer in time
     */
    RawProposal classify(String note, IdeaTree tree, Locale locale);
}
