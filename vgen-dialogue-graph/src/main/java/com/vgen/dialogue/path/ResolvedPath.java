package com.vgen.dialogue.path;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Ordered, non-empty node list from the start node to the target. When {@code fallback} is true the
 * search found no route and the path holds only the target.
 */
public record ResolvedPath(List<ResolvedPathNode> nodes, boolean fallback) {

    public ResolvedPath {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("A resolved path needs at least one node");
        }
        nodes = List.copyOf(nodes);
    }

    @JsonIgnore
    public ResolvedPathNode last() {
        return nodes.get(nodes.size() - 1);
    }

    @JsonIgnore
    public int size() {
        return nodes.size();
    }
}
