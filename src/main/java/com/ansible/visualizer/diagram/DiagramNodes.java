package com.ansible.visualizer.diagram;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Emitted node ids per category, in emission order.
 */
public class DiagramNodes {

    private final Map<NodeCategory, Set<String>> buckets = new EnumMap<>(NodeCategory.class);

    public DiagramNodes() {
        for (NodeCategory category : NodeCategory.values()) {
            buckets.put(category, new LinkedHashSet<>());
        }
    }

    /**
     * @return true if the id was not yet recorded for this category
     */
    public boolean add(NodeCategory category, String nodeId) {
        return buckets.get(category).add(nodeId);
    }

    public Set<String> get(NodeCategory category) {
        return buckets.get(category);
    }
}
