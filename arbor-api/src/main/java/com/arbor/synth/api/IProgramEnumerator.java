/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.synth.api;

import com.arbor.synth.tree.RuleNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Contract for enumerating the complete programs of a grammar within bounds.
 *
 * <p>Every call to {@link #iterator()} starts a fresh search; identical
 * enumerators produce identical sequences.
 */
public interface IProgramEnumerator extends Iterable<RuleNode> {

    @Override
    ProgramIterator iterator();

    default Stream<RuleNode> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    default List<RuleNode> toList() {
        List<RuleNode> programs = new ArrayList<>();
        ProgramIterator it = iterator();
        while (it.hasNext()) {
            programs.add(it.next());
        }
        return programs;
    }

    default long count() {
        long count = 0;
        ProgramIterator it = iterator();
        while (it.hasNext()) {
            it.next();
            count++;
        }
        return count;
    }
}
