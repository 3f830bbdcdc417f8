package com.finFlow.sankeyDemo.pipeline.service;

import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.extraction.model.ExtractionOutcome;
import com.finFlow.sankeyDemo.extraction.service.BucketExtractionService;
import com.finFlow.sankeyDemo.extraction.service.RevenueReconciler;
import com.finFlow.sankeyDemo.flow.model.ColorScheme;
import com.finFlow.sankeyDemo.flow.model.FlowGraph;
import com.finFlow.sankeyDemo.flow.service.FlowGraphBuilder;
import com.finFlow.sankeyDemo.flow.service.LayoutEngine;
import com.finFlow.sankeyDemo.pipeline.exception.InputFileNotFoundException;
import com.finFlow.sankeyDemo.pipeline.model.PipelineState;
import com.finFlow.sankeyDemo.pipeline.model.PipelineStep;
import com.finFlow.sankeyDemo.pipeline.util.OutputPaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Pipeline service - owns a run from summary text to chart file.
 *
 * Workflow steps:
 * LOAD_SUMMARY -> EXTRACT -> RECONCILE -> SAVE_BUCKETS -> BUILD_GRAPH -> LAYOUT -> SAVE_CHART
 *
 * {@link #extract} runs the first four steps, {@link #visualize} starts from a bucket file,
 * and {@link #run} does both. Each run gets its own {@link PipelineState}; nothing is kept
 * between runs.
 */
@Slf4j
@Service
public class FinancialFlowPipeline {

    private final BucketExtractionService bucketExtractionService;
    private final RevenueReconciler revenueReconciler;
    private final BucketFileStore bucketFileStore;
    private final FlowGraphBuilder flowGraphBuilder;
    private final LayoutEngine layoutEngine;
    private final SankeyChartWriter sankeyChartWriter;
    private final String defaultColorScheme;

    public FinancialFlowPipeline(BucketExtractionService bucketExtractionService,
                                 RevenueReconciler revenueReconciler,
                                 BucketFileStore bucketFileStore,
                                 FlowGraphBuilder flowGraphBuilder,
                                 LayoutEngine layoutEngine,
                                 SankeyChartWriter sankeyChartWriter,
                                 @Value("${sankey.layout.color-scheme:professional}") String defaultColorScheme) {
        this.bucketExtractionService = bucketExtractionService;
        this.revenueReconciler = revenueReconciler;
        this.bucketFileStore = bucketFileStore;
        this.flowGraphBuilder = flowGraphBuilder;
        this.layoutEngine = layoutEngine;
        this.sankeyChartWriter = sankeyChartWriter;
        this.defaultColorScheme = defaultColorScheme;
    }

    /**
     * Extracts and reconciles buckets from a summary and writes the bucket file.
     *
     * @param summaryFile Financial summary text file
     * @param bucketFile Output bucket file, or null for {@code <stem>_buckets.json}
     * @param model Model override, or null
     * @return Final run state
     */
    public PipelineState extract(Path summaryFile, Path bucketFile, String model) {
        PipelineState state = newState();
        state.setSummaryPath(summaryFile);
        state.setModel(model);
        state.setBucketFile(bucketFile != null ? bucketFile : OutputPaths.bucketFileFor(summaryFile));
        log.info("Starting extraction - runId: {}, summary: {}", state.getRunId(), summaryFile);

        loadSummary(state);
        extractBuckets(state);
        reconcile(state);
        saveBuckets(state);
        return state;
    }

    /**
     * Builds, lays out and writes the chart for an existing bucket file.
     *
     * @param bucketFile Bucket file to visualize
     * @param chartFile Output chart file, or null for {@code <stem>_sankey.json}
     * @param colorScheme Color scheme name, or null for the configured default
     * @return Final run state
     */
    public PipelineState visualize(Path bucketFile, Path chartFile, String colorScheme) {
        PipelineState state = newState();
        state.setBucketFile(bucketFile);
        state.setChartFile(chartFile != null ? chartFile : OutputPaths.chartFileFor(bucketFile));
        state.setColorScheme(resolveColorScheme(colorScheme));
        log.info("Starting visualization - runId: {}, buckets: {}", state.getRunId(), bucketFile);

        loadBuckets(state);
        buildGraph(state);
        layout(state);
        saveChart(state);
        return state;
    }

    /**
     * Runs every step, writing {@code <stem>_buckets.json} and {@code <stem>_sankey.json}
     * next to the summary.
     */
    public PipelineState run(Path summaryFile, String model, String colorScheme) {
        PipelineState state = newState();
        state.setSummaryPath(summaryFile);
        state.setModel(model);
        state.setBucketFile(OutputPaths.bucketFileFor(summaryFile));
        state.setChartFile(OutputPaths.chartFileFor(summaryFile));
        state.setColorScheme(resolveColorScheme(colorScheme));
        log.info("Starting pipeline run - runId: {}, summary: {}", state.getRunId(), summaryFile);

        loadSummary(state);
        extractBuckets(state);
        reconcile(state);
        saveBuckets(state);
        buildGraph(state);
        layout(state);
        saveChart(state);

        log.info("Pipeline run completed - runId: {}, buckets: {}, chart: {}",
                state.getRunId(), state.getBucketFile(), state.getChartFile());
        return state;
    }

    private PipelineState newState() {
        return PipelineState.builder()
                .runId(UUID.randomUUID().toString())
                .build();
    }

    private ColorScheme resolveColorScheme(String name) {
        return ColorScheme.fromName(name == null || name.isBlank() ? defaultColorScheme : name);
    }

    private void loadSummary(PipelineState state) {
        logStep(PipelineStep.LOAD_SUMMARY, state);
        Path summaryFile = state.getSummaryPath();
        if (!Files.isRegularFile(summaryFile)) {
            throw new InputFileNotFoundException(summaryFile);
        }
        try {
            state.setSummaryText(Files.readString(summaryFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new InputFileNotFoundException(summaryFile, e);
        }
        log.info("Summary loaded - runId: {}, characters: {}", state.getRunId(), state.getSummaryText().length());
    }

    private void extractBuckets(PipelineState state) {
        logStep(PipelineStep.EXTRACT, state);
        ExtractionOutcome outcome = bucketExtractionService.extract(state.getSummaryText(), state.getModel());
        state.setRawBuckets(outcome.buckets());
        state.setExtractionPath(outcome.path());
    }

    private void reconcile(PipelineState state) {
        logStep(PipelineStep.RECONCILE, state);
        BucketSet reconciled = revenueReconciler.reconcile(state.getRawBuckets(), state.getSummaryText(), state.getModel());
        state.setReconciledBuckets(reconciled);
        log.info("Reconciliation completed - runId: {}, changed: {}",
                state.getRunId(), !reconciled.equals(state.getRawBuckets()));
    }

    private void saveBuckets(PipelineState state) {
        logStep(PipelineStep.SAVE_BUCKETS, state);
        bucketFileStore.write(state.getReconciledBuckets(), state.getBucketFile());
    }

    private void loadBuckets(PipelineState state) {
        logStep(PipelineStep.LOAD_BUCKETS, state);
        state.setReconciledBuckets(bucketFileStore.read(state.getBucketFile()));
    }

    private void buildGraph(PipelineState state) {
        logStep(PipelineStep.BUILD_GRAPH, state);
        FlowGraph graph = flowGraphBuilder.build(state.getReconciledBuckets(), OutputPaths.titleFor(state.getBucketFile()));
        state.setGraph(graph);
    }

    private void layout(PipelineState state) {
        logStep(PipelineStep.LAYOUT, state);
        layoutEngine.layout(state.getGraph());
    }

    private void saveChart(PipelineState state) {
        logStep(PipelineStep.SAVE_CHART, state);
        sankeyChartWriter.write(state.getGraph(), state.getColorScheme(), state.getChartFile());
    }

    private void logStep(PipelineStep step, PipelineState state) {
        log.debug("Step {} - runId: {}", step, state.getRunId());
    }
}
