package com.mcainsights.mcainsights.diff;

import java.util.Collections;
import java.util.SortedSet;

/**
 * Three-way split of the union of both snapshots' keys. The sets are pairwise disjoint.
 */
public record KeyPartition(SortedSet<String> appeared, SortedSet<String> disappeared, SortedSet<String> common) {

    public KeyPartition {
        appeared = Collections.unmodifiableSortedSet(appeared);
        disappeared = Collections.unmodifiableSortedSet(disappeared);
        common = Collections.unmodifiableSortedSet(common);
    }
}
