package com.moosivp.analyzer.tree;

import java.util.List;
import java.util.stream.Collectors;

public record Document(List<Node> nodes) {

    public Document {
        nodes = List.copyOf(nodes);
    }

    public <T extends Node> List<T> nodesOf(Class<T> type) {
        return nodes.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public List<Node> nodesOf(NodeKind kind) {
        return nodes.stream().filter(node -> node.kind() == kind).collect(Collectors.toList());
    }
}
