package com.finFlow.sankeyDemo.extraction.model;

import java.util.Objects;

/**
 * Outcome of a model-based extraction: either a usable bucket set or the reason it is unusable.
 */
public final class ExtractionResult {

    private final BucketSet buckets;
    private final String unusableReason;

    private ExtractionResult(BucketSet buckets, String unusableReason) {
        this.buckets = buckets;
        this.unusableReason = unusableReason;
    }

    public static ExtractionResult usable(BucketSet buckets) {
        return new ExtractionResult(Objects.requireNonNull(buckets, "buckets"), null);
    }

    public static ExtractionResult unusable(String reason) {
        return new ExtractionResult(null, reason);
    }

    public boolean isUsable() {
        return buckets != null;
    }

    /**
     * @return Extracted buckets
     * @throws IllegalStateException if the result is unusable
     */
    public BucketSet getBuckets() {
        if (buckets == null) {
            throw new IllegalStateException("Extraction result is unusable: " + unusableReason);
        }
        return buckets;
    }

    public String getUnusableReason() {
        return unusableReason;
    }

    @Override
    public String toString() {
        return isUsable() ? "ExtractionResult[usable]" : "ExtractionResult[unusable: " + unusableReason + "]";
    }
}
