package com.finFlow.sankeyDemo.extraction.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, fully populated mapping from every taxonomy key to its bucket.
 * 
 * Keys that were never set hold a reported 0.0 bucket. Updates return a new set.
 */
@EqualsAndHashCode
@ToString
public final class BucketSet {

    private static final BucketSet EMPTY = new BucketSet(new EnumMap<>(TaxonomyKey.class));

    private final Map<TaxonomyKey, Bucket> buckets;

    private BucketSet(Map<TaxonomyKey, Bucket> source) {
        EnumMap<TaxonomyKey, Bucket> filled = new EnumMap<>(TaxonomyKey.class);
        for (TaxonomyKey key : TaxonomyKey.values()) {
            filled.put(key, source.getOrDefault(key, Bucket.reported(key, 0.0)));
        }
        this.buckets = Collections.unmodifiableMap(filled);
    }

    public static BucketSet empty() {
        return EMPTY;
    }

    /**
     * Builds a set of reported values; keys not in the map default to 0.0.
     */
    public static BucketSet of(Map<TaxonomyKey, Double> values) {
        EnumMap<TaxonomyKey, Bucket> source = new EnumMap<>(TaxonomyKey.class);
        values.forEach((key, value) -> source.put(key, Bucket.reported(key, value == null ? 0.0 : value)));
        return new BucketSet(source);
    }

    public Bucket get(TaxonomyKey key) {
        return buckets.get(key);
    }

    public double value(TaxonomyKey key) {
        return buckets.get(key).value();
    }

    public boolean isPresent(TaxonomyKey key) {
        return buckets.get(key).isPresent();
    }

    public boolean isDerived(TaxonomyKey key) {
        return buckets.get(key).derived();
    }

    public BucketSet withValue(TaxonomyKey key, double value) {
        return with(Bucket.reported(key, value));
    }

    public BucketSet withDerivedValue(TaxonomyKey key, double value) {
        return with(Bucket.derived(key, value));
    }

    private BucketSet with(Bucket bucket) {
        EnumMap<TaxonomyKey, Bucket> copy = new EnumMap<>(buckets);
        copy.put(bucket.name(), bucket);
        return new BucketSet(copy);
    }

    /**
     * All buckets in taxonomy order.
     */
    public List<Bucket> buckets() {
        return new ArrayList<>(buckets.values());
    }

    public boolean hasDerivedBuckets() {
        return buckets.values().stream().anyMatch(Bucket::derived);
    }
}
