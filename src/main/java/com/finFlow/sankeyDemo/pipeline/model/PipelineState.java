package com.finFlow.sankeyDemo.pipeline.model;

import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.extraction.model.ExtractionPath;
import com.finFlow.sankeyDemo.flow.model.ColorScheme;
import com.finFlow.sankeyDemo.flow.model.FlowGraph;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Pipeline state - holds the intermediate results of a single run.
 *
 * Created at the start of a run and discarded at its end.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PipelineState {

    /**
     * Generated id used to correlate the log lines of one run.
     */
    private String runId;

    private Path summaryPath;

    private String summaryText;

    /**
     * Model override for generation calls, or null for the configured default.
     */
    private String model;

    private ExtractionPath extractionPath;

    /**
     * Buckets as extracted, before reconciliation.
     */
    private BucketSet rawBuckets;

    private BucketSet reconciledBuckets;

    private Path bucketFile;

    /**
     * Positioned flow graph.
     */
    private FlowGraph graph;

    private ColorScheme colorScheme;

    private Path chartFile;
}
