package com.finFlow.sankeyDemo.flow.model;

import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Nodes and edges of one visualization run, in taxonomy order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlowGraph {

    private String title;

    /**
     * Note shown when derived nodes are present, otherwise null.
     */
    private String footnote;

    @Builder.Default
    private List<FlowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<FlowEdge> edges = new ArrayList<>();

    public Optional<FlowNode> findNode(TaxonomyKey id) {
        return nodes.stream().filter(node -> node.getId() == id).findFirst();
    }

    public boolean hasEdge(TaxonomyKey source, TaxonomyKey target) {
        return edges.stream().anyMatch(edge -> edge.getSource() == source && edge.getTarget() == target);
    }

    /**
     * Position of a node in {@link #getNodes()}, or -1.
     */
    public int indexOf(TaxonomyKey id) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getId() == id) {
                return i;
            }
        }
        return -1;
    }
}
