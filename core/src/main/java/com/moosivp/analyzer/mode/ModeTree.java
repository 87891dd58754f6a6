package com.moosivp.analyzer.mode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The mode forest of a behavior file, one tree per mode variable.
 */
public record ModeTree(Map<String, List<ModeNode>> roots) {

    public ModeTree {
        Map<String, List<ModeNode>> copy = new LinkedHashMap<>();
        roots.forEach((variable, nodes) -> copy.put(variable, List.copyOf(nodes)));
        roots = Collections.unmodifiableMap(copy);
    }

    public static ModeTree empty() {
        return new ModeTree(Map.of());
    }

    public Set<String> variables() {
        return roots.keySet();
    }

    public List<ModeNode> roots(String modeVariable) {
        return roots.getOrDefault(modeVariable, List.of());
    }

    public Optional<ModeNode> find(String modeVariable, String path) {
        return nodes(modeVariable).stream().filter(node -> node.path().equals(path)).findFirst();
    }

    /** Every node of one variable's tree, parents before children. */
    public List<ModeNode> nodes(String modeVariable) {
        List<ModeNode> result = new ArrayList<>();
        for (ModeNode root : roots(modeVariable)) {
            collect(root, result);
        }
        return result;
    }

    private static void collect(ModeNode node, List<ModeNode> result) {
        result.add(node);
        for (ModeNode child : node.children()) {
            collect(child, result);
        }
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }
}
