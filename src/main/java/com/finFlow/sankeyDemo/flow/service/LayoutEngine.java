package com.finFlow.sankeyDemo.flow.service;

import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import com.finFlow.sankeyDemo.flow.model.ColorClass;
import com.finFlow.sankeyDemo.flow.model.FlowEdge;
import com.finFlow.sankeyDemo.flow.model.FlowGraph;
import com.finFlow.sankeyDemo.flow.model.FlowNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.finFlow.sankeyDemo.extraction.model.TaxonomyKey.*;

/**
 * Positions and colors the nodes and edges of a flow graph.
 *
 * Each key has a fixed stage (column). Within a stage, nodes are spread evenly over
 * [0.1, 0.9] in taxonomy order; a lone node sits at 0.5.
 */
@Slf4j
@Service
public class LayoutEngine {

    static final double MIN_Y = 0.1;
    static final double MAX_Y = 0.9;
    static final double CENTER_Y = 0.5;

    /**
     * Assigns stage, vertical position and color class in place.
     *
     * @param graph Graph from {@link FlowGraphBuilder}
     * @return The same graph, positioned
     */
    public FlowGraph layout(FlowGraph graph) {
        Map<Double, List<FlowNode>> byStage = new TreeMap<>();
        for (FlowNode node : graph.getNodes()) {
            node.setStage(stageOf(node.getId()));
            node.setColorClass(nodeColor(node.getId(), node.getValue()));
            byStage.computeIfAbsent(node.getStage(), stage -> new ArrayList<>()).add(node);
        }

        byStage.values().forEach(LayoutEngine::distributeVertically);

        for (FlowEdge edge : graph.getEdges()) {
            edge.setColorClass(edgeColor(edge.getSource(), edge.getTarget()));
        }

        log.debug("Layout completed - stages: {}, nodes: {}, edges: {}",
                byStage.size(), graph.getNodes().size(), graph.getEdges().size());
        return graph;
    }

    private static void distributeVertically(List<FlowNode> stageNodes) {
        stageNodes.sort(Comparator.comparing(FlowNode::getId));
        int count = stageNodes.size();
        for (int i = 0; i < count; i++) {
            double y = count > 1
                    ? MIN_Y + ((double) i / (count - 1)) * (MAX_Y - MIN_Y)
                    : CENTER_Y;
            stageNodes.get(i).setYPosition(y);
        }
    }

    /**
     * Horizontal stage of a key, left to right through the flow.
     */
    public static double stageOf(TaxonomyKey key) {
        return switch (key) {
            case PRODUCTS, SERVICES -> 0.0;
            case REVENUE -> 0.15;
            case COST_OF_REVENUE, GROSS_PROFIT -> 0.3;
            case OPERATING_EXPENSES, OPERATING_INCOME -> 0.45;
            case EBIT, OTHER_INCOME_EXPENSE -> 0.6;
            case INTEREST_INCOME, INTEREST_EXPENSE, EBT -> 0.75;
            case TAXES, NET_INCOME -> 0.9;
        };
    }

    /**
     * Node color by financial role; Other Income/Expense follows its sign.
     */
    public static ColorClass nodeColor(TaxonomyKey key, double value) {
        return switch (key) {
            case PRODUCTS, SERVICES, REVENUE -> ColorClass.REVENUE;
            case COST_OF_REVENUE, OPERATING_EXPENSES, INTEREST_EXPENSE, TAXES -> ColorClass.EXPENSE;
            case GROSS_PROFIT, OPERATING_INCOME, EBIT, EBT, NET_INCOME -> ColorClass.PROFIT;
            case INTEREST_INCOME -> ColorClass.POSITIVE;
            case OTHER_INCOME_EXPENSE -> value >= 0 ? ColorClass.POSITIVE : ColorClass.NEGATIVE;
        };
    }

    /**
     * Edge color from its endpoints. Any edge touching Taxes is a tax flow.
     */
    public static ColorClass edgeColor(TaxonomyKey source, TaxonomyKey target) {
        if (source == TAXES || target == TAXES) {
            return ColorClass.TAX;
        }
        if ((source == PRODUCTS || source == SERVICES) && target == REVENUE) {
            return ColorClass.REVENUE;
        }
        if (target == COST_OF_REVENUE || target == OPERATING_EXPENSES) {
            return ColorClass.EXPENSE;
        }
        if (target == GROSS_PROFIT || target == OPERATING_INCOME || target == EBIT || target == EBT) {
            return ColorClass.PROFIT;
        }
        if (source == INTEREST_INCOME || target == INTEREST_INCOME) {
            return ColorClass.POSITIVE;
        }
        if (source == INTEREST_EXPENSE || target == INTEREST_EXPENSE) {
            return ColorClass.NEGATIVE;
        }
        if (target == NET_INCOME) {
            return ColorClass.PROFIT;
        }
        return ColorClass.NEUTRAL;
    }
}
