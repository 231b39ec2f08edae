package com.memlayout.generator.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ArrayList;

/**
 * Parent id to direct-children index over a {@link NodeTree}.
 *
 * Children are node indices in the tree's insertion order; consumers that care
 * about layout order sort by offset themselves.
 */
public final class ChildIndex {

    private final Map<Long, List<Integer>> childrenByParent;

    private ChildIndex(Map<Long, List<Integer>> childrenByParent) {
        this.childrenByParent = childrenByParent;
    }

    /**
     * Builds the index in a single pass over the tree.
     */
    public static ChildIndex build(NodeTree tree) {
        Map<Long, List<Integer>> map = new HashMap<>();
        List<Node> nodes = tree.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            map.computeIfAbsent(nodes.get(i).getParentId(), k -> new ArrayList<>()).add(i);
        }
        map.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return new ChildIndex(map);
    }

    /**
     * Indices of the direct children of {@code parentId}; empty when it has none.
     */
    public List<Integer> childrenOf(long parentId) {
        return childrenByParent.getOrDefault(parentId, List.of());
    }
}
