package com.arbor.synth.api;

import com.arbor.synth.api.model.SearchStatistics;
import com.arbor.synth.tree.RuleNode;

import java.util.Iterator;

/**
 * Lazy iterator over complete programs. Stopping iteration cancels the search.
 */
public interface ProgramIterator extends Iterator<RuleNode> {

    /**
     * Counters accumulated by this iterator so far.
     */
    SearchStatistics statistics();
}
