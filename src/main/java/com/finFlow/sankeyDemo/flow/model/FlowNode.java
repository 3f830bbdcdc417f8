package com.finFlow.sankeyDemo.flow.model;

import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Node of the flow graph. Stage, vertical position and color are filled in by layout.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlowNode {

    private TaxonomyKey id;

    private String label;

    /**
     * Signed value in millions.
     */
    private double value;

    private boolean derived;

    /**
     * Horizontal stage in [0.0, 1.0].
     */
    private double stage;

    /**
     * Vertical offset in [0.0, 1.0].
     */
    private double yPosition;

    private ColorClass colorClass;
}
