package com.finFlow.sankeyDemo.extraction.model;

/**
 * Raw buckets of one extraction together with the extractor that produced them.
 */
public record ExtractionOutcome(BucketSet buckets, ExtractionPath path) {
}
