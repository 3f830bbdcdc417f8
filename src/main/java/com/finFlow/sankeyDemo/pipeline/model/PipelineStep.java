package com.finFlow.sankeyDemo.pipeline.model;

/**
 * Steps of a pipeline run, in execution order.
 */
public enum PipelineStep {
    LOAD_SUMMARY,
    EXTRACT,
    RECONCILE,
    SAVE_BUCKETS,
    LOAD_BUCKETS,
    BUILD_GRAPH,
    LAYOUT,
    SAVE_CHART
}
