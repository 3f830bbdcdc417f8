package com.finFlow.sankeyDemo.extraction.model;

/**
 * Which extractor produced a run's raw buckets.
 */
public enum ExtractionPath {
    PRIMARY,
    FALLBACK
}
