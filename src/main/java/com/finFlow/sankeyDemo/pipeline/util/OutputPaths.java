package com.finFlow.sankeyDemo.pipeline.util;

import com.finFlow.sankeyDemo.flow.service.FlowGraphBuilder;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Default file names and chart titles derived from input paths.
 */
public final class OutputPaths {

    public static final String BUCKETS_SUFFIX = "_buckets.json";
    public static final String CHART_SUFFIX = "_sankey.json";

    private OutputPaths() {}

    /**
     * {@code <dir>/<stem>_buckets.json} next to the summary file.
     */
    public static Path bucketFileFor(Path summaryFile) {
        return summaryFile.resolveSibling(stemOf(summaryFile) + BUCKETS_SUFFIX);
    }

    /**
     * {@code <dir>/<stem>_sankey.json} next to the given source file.
     */
    public static Path chartFileFor(Path sourceFile) {
        return sourceFile.resolveSibling(stemOf(sourceFile) + CHART_SUFFIX);
    }

    /**
     * Chart title from a bucket file name: the prefix before the first underscore, capitalized.
     * {@code acme_q3_buckets.json} gives {@code Acme - Financial Flow Analysis}.
     *
     * @param bucketFile Bucket file, or null
     * @return Title, or the default title when no usable name is available
     */
    public static String titleFor(Path bucketFile) {
        if (bucketFile == null || bucketFile.getFileName() == null) {
            return FlowGraphBuilder.DEFAULT_TITLE;
        }
        String stem = stemOf(bucketFile);
        int underscore = stem.indexOf('_');
        String base = underscore >= 0 ? stem.substring(0, underscore) : stem;
        if (base.isBlank()) {
            return FlowGraphBuilder.DEFAULT_TITLE;
        }
        String capitalized = base.substring(0, 1).toUpperCase(Locale.ROOT) + base.substring(1).toLowerCase(Locale.ROOT);
        return capitalized + " - " + FlowGraphBuilder.DEFAULT_TITLE;
    }

    static String stemOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
