package com.finFlow.sankeyDemo.flow.service;

import com.finFlow.sankeyDemo.flow.dto.SankeyChartDTO;
import com.finFlow.sankeyDemo.flow.model.ColorScheme;
import com.finFlow.sankeyDemo.flow.model.FlowEdge;
import com.finFlow.sankeyDemo.flow.model.FlowGraph;
import com.finFlow.sankeyDemo.flow.model.FlowNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a laid-out flow graph into the renderer-facing chart DTO.
 * Edge endpoints become indices into the node list.
 */
@Service
public class SankeyChartAssembler {

    public SankeyChartDTO assemble(FlowGraph graph, ColorScheme colorScheme) {
        List<SankeyChartDTO.Node> nodes = new ArrayList<>();
        for (FlowNode node : graph.getNodes()) {
            nodes.add(SankeyChartDTO.Node.builder()
                    .label(node.getLabel())
                    .stage(node.getStage())
                    .yPosition(node.getYPosition())
                    .colorClass(node.getColorClass())
                    .color(colorScheme.colorFor(node.getColorClass()))
                    .build());
        }

        List<SankeyChartDTO.Edge> edges = new ArrayList<>();
        for (FlowEdge edge : graph.getEdges()) {
            edges.add(SankeyChartDTO.Edge.builder()
                    .sourceIndex(graph.indexOf(edge.getSource()))
                    .targetIndex(graph.indexOf(edge.getTarget()))
                    .magnitude(edge.getMagnitude())
                    .colorClass(edge.getColorClass())
                    .color(colorScheme.colorFor(edge.getColorClass()))
                    .build());
        }

        return SankeyChartDTO.builder()
                .title(graph.getTitle())
                .footnote(graph.getFootnote())
                .colorScheme(colorScheme.getSchemeName())
                .nodes(nodes)
                .edges(edges)
                .build();
    }
}
