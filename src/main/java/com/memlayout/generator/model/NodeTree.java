package com.memlayout.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;

/**
 * Ordered, id-addressed collection of {@link Node}s.
 *
 * The tree is an arena: nodes point at each other only through ids, so
 * pointer cycles between structs are representable without ownership cycles.
 */
public class NodeTree {

    public static final long DEFAULT_BASE_ADDRESS = 0x00400000L;

    @Getter
    private final List<Node> nodes;

    @Getter
    private final long baseAddress;

    private final Map<Long, Integer> indexById;

    public NodeTree(List<Node> nodes) {
        this(nodes, DEFAULT_BASE_ADDRESS);
    }

    public NodeTree(List<Node> nodes, long baseAddress) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.baseAddress = baseAddress;
        this.indexById = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            indexById.putIfAbsent(this.nodes.get(i).getId(), i);
        }
    }

    public static NodeTree empty() {
        return new NodeTree(List.of());
    }

    public int size() {
        return nodes.size();
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    /**
     * @return the index of the node with this id, or -1
     */
    public int indexOfId(long id) {
        Integer idx = indexById.get(id);
        return idx == null ? -1 : idx;
    }

    public Optional<Node> findById(long id) {
        int idx = indexOfId(id);
        return idx < 0 ? Optional.empty() : Optional.of(nodes.get(idx));
    }

    /**
     * Linear scan for direct children. Prefer a {@link ChildIndex} for repeated lookups.
     */
    public List<Integer> childrenOf(long parentId) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getParentId() == parentId) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * Total byte size of the struct or array rooted at {@code id}: the furthest
     * {@code offset + size} among its direct children, 0 without children.
     * Arrays additionally cover {@code arrayLen} elements of their element stride.
     * Sizes saturate at {@link Long#MAX_VALUE} instead of wrapping.
     */
    public long structSpan(long id, ChildIndex index) {
        return structSpan(id, index, new HashSet<>());
    }

    public long structSpan(long id) {
        return structSpan(id, ChildIndex.build(this));
    }

    private long structSpan(long id, ChildIndex index, Set<Long> inProgress) {
        if (!inProgress.add(id)) {
            return 0;
        }
        long maxEnd = 0;
        for (int ci : index.childrenOf(id)) {
            Node child = nodes.get(ci);
            long end = saturatedAdd(Math.max(0, child.getOffset()), byteSize(child, index, inProgress));
            if (end > maxEnd) {
                maxEnd = end;
            }
        }
        Optional<Node> self = findById(id);
        if (self.isPresent() && self.get().getKind() == NodeKind.ARRAY) {
            maxEnd = Math.max(maxEnd, declaredArraySize(self.get(), index, inProgress));
        }
        inProgress.remove(id);
        return maxEnd;
    }

    /**
     * Bytes an array declaration {@code T name[arrayLen]} occupies:
     * {@code arrayLen} elements of the element stride. May be smaller than
     * the array's span when its element child reaches further.
     */
    public long declaredArraySize(Node array, ChildIndex index) {
        return declaredArraySize(array, index, new HashSet<>());
    }

    private long declaredArraySize(Node array, ChildIndex index, Set<Long> inProgress) {
        return saturatedMultiply(Math.max(0, array.getArrayLen()), elementStride(array, index, inProgress));
    }

    private long elementStride(Node array, ChildIndex index, Set<Long> inProgress) {
        for (int ci : index.childrenOf(array.getId())) {
            Node element = nodes.get(ci);
            if (element.getKind() == NodeKind.STRUCT) {
                return structSpan(element.getId(), index, inProgress);
            }
        }
        NodeKind elementKind = array.getElementKind();
        return elementKind.isContainer() ? 0 : elementKind.getSize();
    }

    /**
     * Byte size of a node as laid out inside its parent. Negative lengths count as 0.
     */
    public long byteSize(Node node, ChildIndex index) {
        return byteSize(node, index, new HashSet<>());
    }

    private long byteSize(Node node, ChildIndex index, Set<Long> inProgress) {
        return switch (node.getKind()) {
            case STRUCT, ARRAY -> structSpan(node.getId(), index, inProgress);
            case UTF8 -> Math.max(0, node.getStrLen());
            case UTF16 -> 2L * Math.max(0, node.getStrLen());
            case PADDING -> Math.max(1, node.getArrayLen());
            default -> node.getKind().getSize();
        };
    }

    /**
     * Product of two non-negative sizes, {@link Long#MAX_VALUE} on overflow.
     */
    public static long saturatedMultiply(long a, long b) {
        if (a != 0 && b > Long.MAX_VALUE / a) {
            return Long.MAX_VALUE;
        }
        return a * b;
    }

    /**
     * Sum of two non-negative sizes, {@link Long#MAX_VALUE} on overflow.
     */
    public static long saturatedAdd(long a, long b) {
        return b > Long.MAX_VALUE - a ? Long.MAX_VALUE : a + b;
    }

    /**
     * Number of ancestors between the node at {@code index} and the top level.
     */
    public int depthOf(int index) {
        int depth = 0;
        Set<Integer> visited = new HashSet<>();
        int cur = index;
        while (cur >= 0 && cur < nodes.size() && nodes.get(cur).getParentId() != 0) {
            if (!visited.add(cur)) {
                break;
            }
            cur = indexOfId(nodes.get(cur).getParentId());
            if (cur < 0) {
                break;
            }
            depth++;
        }
        return depth;
    }

    /**
     * Name path from the top level down to {@code id}, e.g. {@code "world > player > pos"}.
     */
    public String breadcrumb(long id) {
        List<String> parts = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        long cur = id;
        while (cur != 0 && seen.add(cur)) {
            int idx = indexOfId(cur);
            if (idx < 0) {
                break;
            }
            Node n = nodes.get(idx);
            parts.add(n.hasName() ? n.getName() : "<unnamed>");
            cur = n.getParentId();
        }
        Collections.reverse(parts);
        return String.join(" > ", parts);
    }
}
