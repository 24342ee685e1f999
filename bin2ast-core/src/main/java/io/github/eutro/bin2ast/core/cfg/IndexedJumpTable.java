package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.graph.NodeId;

import java.util.*;

/**
 * A {@link JumpTable} given as its list of entries, where entry {@code i} is the target of index {@code i}.
 */
public final class IndexedJumpTable implements JumpTable {
    private final List<NodeId> entries;
    private final Map<NodeId, SortedSet<Integer>> indices = new HashMap<>();

    /**
     * Construct a jump table from its entries.
     *
     * @param entries The target of each index.
     */
    public IndexedJumpTable(List<NodeId> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        for (int i = 0; i < entries.size(); i++) {
            indices.computeIfAbsent(entries.get(i), $ -> new TreeSet<>()).add(i);
        }
    }

    public List<NodeId> entries() {
        return entries;
    }

    @Override
    public boolean hasTarget(NodeId target) {
        return indices.containsKey(target);
    }

    @Override
    public SortedSet<Integer> getTarget(NodeId target) {
        SortedSet<Integer> set = indices.get(target);
        return set == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(set);
    }

    @Override
    public String toString() {
        return "JumpTable" + entries;
    }
}
