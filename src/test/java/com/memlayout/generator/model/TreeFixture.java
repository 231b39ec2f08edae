package com.memlayout.generator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds layout trees for tests, assigning ids in insertion order starting at 1.
 */
public class TreeFixture {

    private final List<Node> nodes = new ArrayList<>();
    private long nextId = 1;

    public long struct(long parentId, int offset, String name, String typeName) {
        return add(Node.builder()
                .kind(NodeKind.STRUCT)
                .parentId(parentId)
                .offset(offset)
                .name(name)
                .structTypeName(typeName));
    }

    public long field(long parentId, int offset, NodeKind kind, String name) {
        return add(Node.builder()
                .kind(kind)
                .parentId(parentId)
                .offset(offset)
                .name(name));
    }

    public long pointer(long parentId, int offset, NodeKind kind, String name, long refId) {
        return add(Node.builder()
                .kind(kind)
                .parentId(parentId)
                .offset(offset)
                .name(name)
                .refId(refId));
    }

    public long array(long parentId, int offset, String name, NodeKind elementKind, int count) {
        return add(Node.builder()
                .kind(NodeKind.ARRAY)
                .parentId(parentId)
                .offset(offset)
                .name(name)
                .elementKind(elementKind)
                .arrayLen(count));
    }

    public long add(Node.NodeBuilder builder) {
        long id = nextId++;
        nodes.add(builder.id(id).build());
        return id;
    }

    public NodeTree build() {
        return new NodeTree(nodes);
    }
}
