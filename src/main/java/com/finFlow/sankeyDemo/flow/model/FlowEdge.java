package com.finFlow.sankeyDemo.flow.model;

import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed flow between two nodes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlowEdge {

    private TaxonomyKey source;

    private TaxonomyKey target;

    /**
     * Absolute value of the target node, never negative.
     */
    private double magnitude;

    private ColorClass colorClass;
}
